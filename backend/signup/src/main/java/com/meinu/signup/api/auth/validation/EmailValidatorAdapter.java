package com.meinu.signup.api.auth.validation;

import jakarta.validation.Validator;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.springframework.stereotype.Component;

@Component
public class EmailValidatorAdapter implements EmailValidator {
    private final Validator validator;

    public EmailValidatorAdapter(Validator validator) {
        this.validator = validator;
    }

    @Override
    public boolean isValid(String email) {
        return validator.validateValue(EmailAddress.class, "value", email).isEmpty();
    }

    static class EmailAddress {
        @Email
        @NotBlank
        private String value;
    }
}
