package com.meinu.signup.global.common.base;

import org.springframework.http.HttpStatus;

public enum BaseResponseStatus {
    SUCCESS(true, HttpStatus.OK.value(), null, "요청에 성공했습니다."),

    // Common
    INVALID_REQUEST(false, HttpStatus.BAD_REQUEST.value(), null, "잘못된 요청입니다."),
    UNAUTHORIZED(false, HttpStatus.UNAUTHORIZED.value(), null, "인증이 필요합니다."),
    METHOD_NOT_ALLOWED(false, HttpStatus.METHOD_NOT_ALLOWED.value(), null, "지원하지 않는 HTTP 메서드입니다."),
    UNSUPPORTED_MEDIA_TYPE(false, HttpStatus.UNSUPPORTED_MEDIA_TYPE.value(), null, "지원하지 않는 Content-Type입니다."),
    SERVER_ERROR(false, HttpStatus.INTERNAL_SERVER_ERROR.value(), "ServerError", "서버 오류가 발생했습니다."),

    // Request parameters
    MISSING_PARAM(false, HttpStatus.BAD_REQUEST.value(), "MissingParam", "필수 파라미터가 누락되었습니다."),
    INVALID_PARAM(false, HttpStatus.BAD_REQUEST.value(), "InvalidParam", "유효하지 않은 파라미터입니다."),

    // Member
    EMAIL_ALREADY_EXISTS(false, HttpStatus.CONFLICT.value(), null, "이미 가입된 이메일입니다."),
    PASSWORD_TOO_LONG(false, HttpStatus.BAD_REQUEST.value(), null, "비밀번호는 72바이트를 넘을 수 없습니다."),
    ;

    private final boolean isSuccess;
    private final int code;
    private final String kind;
    private final String message;

    BaseResponseStatus(boolean isSuccess, int code, String kind, String message) {
        this.isSuccess = isSuccess;
        this.code = code;
        this.kind = kind;
        this.message = message;
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

    public String getMessage() {
        return message;
    }
}
