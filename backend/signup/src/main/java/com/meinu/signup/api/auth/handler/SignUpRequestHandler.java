package com.meinu.signup.api.auth.handler;

import com.meinu.signup.api.auth.dto.request.SignupRequest;
import com.meinu.signup.api.auth.usecase.AccountCreator;
import com.meinu.signup.api.auth.usecase.AccountInput;
import com.meinu.signup.api.auth.usecase.AccountRecord;
import com.meinu.signup.api.auth.validation.EmailValidator;
import com.meinu.signup.global.common.base.BaseResponse;
import com.meinu.signup.global.common.http.HttpResponses;
import com.meinu.signup.global.error.exception.InvalidParamException;
import com.meinu.signup.global.error.exception.MissingParamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

public class SignUpRequestHandler implements RequestHandler<SignupRequest, AccountRecord> {
    private static final Logger log = LoggerFactory.getLogger(SignUpRequestHandler.class);

    // checked in this order; the first missing one is reported
    private static final Map<String, Function<SignupRequest, String>> REQUIRED_FIELDS = new LinkedHashMap<>();

    static {
        REQUIRED_FIELDS.put("email", SignupRequest::email);
        REQUIRED_FIELDS.put("name", SignupRequest::name);
        REQUIRED_FIELDS.put("password", SignupRequest::password);
        REQUIRED_FIELDS.put("passwordConfirmation", SignupRequest::passwordConfirmation);
    }

    private static final SignupRequest EMPTY = new SignupRequest(null, null, null, null);

    private final EmailValidator emailValidator;
    private final AccountCreator accountCreator;

    public SignUpRequestHandler(EmailValidator emailValidator, AccountCreator accountCreator) {
        this.emailValidator = Objects.requireNonNull(emailValidator, "emailValidator");
        this.accountCreator = Objects.requireNonNull(accountCreator, "accountCreator");
    }

    @Override
    public ResponseEntity<BaseResponse<AccountRecord>> handle(HttpRequest<SignupRequest> request) {
        SignupRequest body = request.body() != null ? request.body() : EMPTY;
        try {
            for (Map.Entry<String, Function<SignupRequest, String>> field : REQUIRED_FIELDS.entrySet()) {
                if (!StringUtils.hasLength(field.getValue().apply(body))) {
                    return HttpResponses.error(new MissingParamException(field.getKey()));
                }
            }
            if (!body.password().equals(body.passwordConfirmation())) {
                return HttpResponses.error(new InvalidParamException("passwordConfirmation"));
            }
            if (!emailValidator.isValid(body.email())) {
                return HttpResponses.error(new InvalidParamException("email"));
            }
            AccountRecord account = accountCreator.add(new AccountInput(body.email(), body.name(), body.password()));
            return HttpResponses.ok(account);
        } catch (RuntimeException e) {
            log.error("SignUp: collaborator failed for email={}", body.email(), e);
            return HttpResponses.serverError();
        }
    }
}
