package com.meinu.signup.global.common.base;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class BaseResponse<T> {
    private final boolean isSuccess;
    private final int code;
    private final String kind;
    private final String field;
    private final String message;
    private final T result;

    private BaseResponse(boolean isSuccess, int code, String kind, String field, String message, T result) {
        this.isSuccess = isSuccess;
        this.code = code;
        this.kind = kind;
        this.field = field;
        this.message = message;
        this.result = result;
    }

    public static <T> BaseResponse<T> success(T result) {
        BaseResponseStatus s = BaseResponseStatus.SUCCESS;
        return new BaseResponse<>(true, s.getCode(), null, null, s.getMessage(), result);
    }

    public static <T> BaseResponse<T> of(BaseResponseStatus status) {
        return new BaseResponse<>(status.isSuccess(), status.getCode(), status.getKind(), null, status.getMessage(),
                null);
    }

    public static <T> BaseResponse<T> of(BaseException e) {
        BaseResponseStatus s = e.getStatus();
        return new BaseResponse<>(s.isSuccess(), s.getCode(), s.getKind(), e.getField(), e.getMessage(), null);
    }

    public boolean isSuccess() {
        return isSuccess;
    }

    public int getCode() {
        return code;
    }

    public String getKind() {
        return kind;
    }

    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    public T getResult() {
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaseResponse<?> other))
            return false;
        return isSuccess == other.isSuccess && code == other.code && Objects.equals(kind, other.kind)
                && Objects.equals(field, other.field) && Objects.equals(message, other.message)
                && Objects.equals(result, other.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(isSuccess, code, kind, field, message, result);
    }

    @Override
    public String toString() {
        return "BaseResponse{code=" + code + ", kind=" + kind + ", field=" + field + ", result=" + result + "}";
    }
}
