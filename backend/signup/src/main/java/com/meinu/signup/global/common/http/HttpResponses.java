package com.meinu.signup.global.common.http;

import com.meinu.signup.global.common.base.BaseException;
import com.meinu.signup.global.common.base.BaseResponse;
import com.meinu.signup.global.common.base.BaseResponseStatus;
import com.meinu.signup.global.error.exception.ServerErrorException;
import org.springframework.http.ResponseEntity;

public final class HttpResponses {

    private HttpResponses() {
    }

    public static <T> ResponseEntity<BaseResponse<T>> ok(T result) {
        return ResponseEntity.ok(BaseResponse.success(result));
    }

    public static <T> ResponseEntity<BaseResponse<T>> of(BaseResponseStatus status) {
        return ResponseEntity.status(status.getCode()).body(BaseResponse.of(status));
    }

    public static <T> ResponseEntity<BaseResponse<T>> serverError() {
        return error(new ServerErrorException());
    }

    public static <T> ResponseEntity<BaseResponse<T>> error(BaseException e) {
        return ResponseEntity.status(e.getStatus().getCode()).body(BaseResponse.of(e));
    }
}
