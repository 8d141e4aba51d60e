package com.meinu.signup.global.error.exception;

import com.meinu.signup.global.common.base.BaseException;
import com.meinu.signup.global.common.base.BaseResponseStatus;

public class MissingParamException extends BaseException {
    public MissingParamException(String field) {
        super(BaseResponseStatus.MISSING_PARAM, field);
    }
}
