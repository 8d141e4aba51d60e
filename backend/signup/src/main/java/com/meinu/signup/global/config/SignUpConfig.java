package com.meinu.signup.global.config;

import com.meinu.signup.api.auth.handler.SignUpRequestHandler;
import com.meinu.signup.api.auth.usecase.AccountCreator;
import com.meinu.signup.api.auth.validation.EmailValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SignUpConfig {

    @Bean
    public SignUpRequestHandler signUpRequestHandler(EmailValidator emailValidator, AccountCreator accountCreator) {
        return new SignUpRequestHandler(emailValidator, accountCreator);
    }
}
