package com.meinu.signup.api.auth.dto.request;

public record SignupRequest(
        String name,
        String email,
        String password,
        String passwordConfirmation) {
}
