package com.meinu.signup.api.auth.validation;

public interface EmailValidator {
    boolean isValid(String email);
}
