package com.meinu.signup.global.error;

import com.meinu.signup.global.common.base.BaseException;
import com.meinu.signup.global.common.base.BaseResponse;
import com.meinu.signup.global.common.base.BaseResponseStatus;
import com.meinu.signup.global.common.http.HttpResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<BaseResponse<Void>> handleBaseException(BaseException e) {
        return HttpResponses.error(e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<BaseResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        if (log.isDebugEnabled()) {
            log.debug("Unreadable request body: {}", e.getMessage());
        }
        return ResponseEntity.badRequest().body(BaseResponse.of(BaseResponseStatus.INVALID_REQUEST));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<BaseResponse<Void>> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException e) {
        if (log.isDebugEnabled()) {
            log.debug("Unsupported content type: {}", e.getContentType());
        }
        return HttpResponses.of(BaseResponseStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<BaseResponse<Void>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e) {
        if (log.isDebugEnabled()) {
            log.debug("Unsupported method: {}", e.getMethod());
        }
        return HttpResponses.of(BaseResponseStatus.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<BaseResponse<Void>> handleOther(Exception e) {
        log.error("Unhandled exception", e);
        return HttpResponses.serverError();
    }
}
