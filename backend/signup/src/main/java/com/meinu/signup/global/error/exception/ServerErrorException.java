package com.meinu.signup.global.error.exception;

import com.meinu.signup.global.common.base.BaseException;
import com.meinu.signup.global.common.base.BaseResponseStatus;

/**
 * Opaque failure returned to clients; the underlying cause is never part of the response body.
 */
public class ServerErrorException extends BaseException {
    public ServerErrorException() {
        super(BaseResponseStatus.SERVER_ERROR);
    }
}
