package com.meinu.signup.global.error.exception;

import com.meinu.signup.global.common.base.BaseException;
import com.meinu.signup.global.common.base.BaseResponseStatus;

public class InvalidParamException extends BaseException {
    public InvalidParamException(String field) {
        super(BaseResponseStatus.INVALID_PARAM, field);
    }
}
