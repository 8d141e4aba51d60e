package com.meinu.signup.global.common.base;

public class BaseException extends RuntimeException {
    private final BaseResponseStatus status;
    private final String field;

    public BaseException(BaseResponseStatus status) {
        this(status, null);
    }

    public BaseException(BaseResponseStatus status, String field) {
        super(field == null ? status.getMessage() : status.getMessage() + " (" + field + ")");
        this.status = status;
        this.field = field;
    }

    public BaseResponseStatus getStatus() {
        return status;
    }

    public String getField() {
        return field;
    }
}
