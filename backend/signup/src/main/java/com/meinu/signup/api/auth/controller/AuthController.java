package com.meinu.signup.api.auth.controller;

import com.meinu.signup.api.auth.dto.request.SignupRequest;
import com.meinu.signup.api.auth.handler.HttpRequest;
import com.meinu.signup.api.auth.handler.SignUpRequestHandler;
import com.meinu.signup.api.auth.usecase.AccountRecord;
import com.meinu.signup.global.common.base.BaseResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class AuthController {
    private final SignUpRequestHandler signUpRequestHandler;

    public AuthController(SignUpRequestHandler signUpRequestHandler) {
        this.signUpRequestHandler = signUpRequestHandler;
    }

    // field validation happens in the handler, so no @Valid here
    @PostMapping("/signup")
    public ResponseEntity<BaseResponse<AccountRecord>> signup(@RequestBody(required = false) SignupRequest req) {
        return signUpRequestHandler.handle(new HttpRequest<>(req));
    }
}
