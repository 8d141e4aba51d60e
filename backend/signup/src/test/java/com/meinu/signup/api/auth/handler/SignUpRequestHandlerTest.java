package com.meinu.signup.api.auth.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.meinu.signup.api.auth.dto.request.SignupRequest;
import com.meinu.signup.api.auth.usecase.AccountCreator;
import com.meinu.signup.api.auth.usecase.AccountInput;
import com.meinu.signup.api.auth.usecase.AccountRecord;
import com.meinu.signup.api.auth.validation.EmailValidator;
import com.meinu.signup.global.common.base.BaseResponse;
import com.meinu.signup.global.common.base.BaseResponseStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

@ExtendWith(MockitoExtension.class)
class SignUpRequestHandlerTest {

    private static final AccountRecord ACCOUNT = new AccountRecord(1L, "any_name", "any_email@mail.com");

    @Mock
    private EmailValidator emailValidator;

    @Mock
    private AccountCreator accountCreator;

    @InjectMocks
    private SignUpRequestHandler handler;

    @Test
    void returns400WhenNameIsMissing() {
        ResponseEntity<BaseResponse<AccountRecord>> res = handle(
                new SignupRequest(null, "any_email@mail.com", "any_password", "any_password"));

        assertMissingParam(res, "name");
        verifyNoInteractions(emailValidator, accountCreator);
    }

    @Test
    void returns400WhenEmailIsMissing() {
        ResponseEntity<BaseResponse<AccountRecord>> res = handle(
                new SignupRequest("any_name", null, "any_password", "any_password"));

        assertMissingParam(res, "email");
        verifyNoInteractions(emailValidator, accountCreator);
    }

    @Test
    void returns400WhenPasswordIsMissing() {
        ResponseEntity<BaseResponse<AccountRecord>> res = handle(
                new SignupRequest("any_name", "any_email@mail.com", null, "any_password"));

        assertMissingParam(res, "password");
    }

    @Test
    void returns400WhenPasswordConfirmationIsMissing() {
        ResponseEntity<BaseResponse<AccountRecord>> res = handle(
                new SignupRequest("any_name", "any_email@mail.com", "any_password", null));

        assertMissingParam(res, "passwordConfirmation");
    }

    @Test
    void reportsEmailBeforeNameWhenBothAreMissing() {
        ResponseEntity<BaseResponse<AccountRecord>> res = handle(
                new SignupRequest(null, null, "any_password", "any_password"));

        assertMissingParam(res, "email");
    }

    @Test
    void treatsMissingBodyAsAllFieldsMissing() {
        ResponseEntity<BaseResponse<AccountRecord>> res = handler.handle(new HttpRequest<>(null));

        assertMissingParam(res, "email");
    }

    @ParameterizedTest
    @ValueSource(strings = {"name", "email", "password", "passwordConfirmation"})
    void treatsEmptyStringAsMissing(String field) {
        SignupRequest req = new SignupRequest(
                field.equals("name") ? "" : "any_name",
                field.equals("email") ? "" : "any_email@mail.com",
                field.equals("password") ? "" : "any_password",
                field.equals("passwordConfirmation") ? "" : "any_password");

        assertMissingParam(handle(req), field);
    }

    @Test
    void acceptsBlankButNonEmptyName() {
        when(emailValidator.isValid("any_email@mail.com")).thenReturn(true);
        when(accountCreator.add(any())).thenReturn(ACCOUNT);

        ResponseEntity<BaseResponse<AccountRecord>> res = handle(
                new SignupRequest(" ", "any_email@mail.com", "any_password", "any_password"));

        assertThat(res.getStatusCode().value()).isEqualTo(200);
        verify(accountCreator).add(new AccountInput("any_email@mail.com", " ", "any_password"));
    }

    @Test
    void returns400WhenPasswordConfirmationDoesNotMatch() {
        ResponseEntity<BaseResponse<AccountRecord>> res = handle(
                new SignupRequest("any_name", "any_email@mail.com", "a", "b"));

        assertInvalidParam(res, "passwordConfirmation");
        verifyNoInteractions(emailValidator, accountCreator);
    }

    @Test
    void comparesPasswordConfirmationCaseSensitively() {
        ResponseEntity<BaseResponse<AccountRecord>> res = handle(
                new SignupRequest("any_name", "any_email@mail.com", "Password", "password"));

        assertInvalidParam(res, "passwordConfirmation");
    }

    @Test
    void returns400WhenEmailIsInvalid() {
        when(emailValidator.isValid("invalid_email@mail.com")).thenReturn(false);

        ResponseEntity<BaseResponse<AccountRecord>> res = handle(
                new SignupRequest("any_name", "invalid_email@mail.com", "any_password", "any_password"));

        assertInvalidParam(res, "email");
        verifyNoInteractions(accountCreator);
    }

    @Test
    void callsEmailValidatorWithSubmittedEmail() {
        when(emailValidator.isValid("any_email@mail.com")).thenReturn(true);
        when(accountCreator.add(any())).thenReturn(ACCOUNT);

        handle(validRequest());

        verify(emailValidator, times(1)).isValid("any_email@mail.com");
    }

    @Test
    void callsAccountCreatorOnceWithoutPasswordConfirmation() {
        when(emailValidator.isValid("any_email@mail.com")).thenReturn(true);
        when(accountCreator.add(any())).thenReturn(ACCOUNT);

        handle(validRequest());

        verify(accountCreator, times(1))
                .add(new AccountInput("any_email@mail.com", "any_name", "any_password"));
    }

    @Test
    void returns500WhenEmailValidatorThrows() {
        when(emailValidator.isValid("any_email@mail.com")).thenThrow(new IllegalStateException("validator down"));

        ResponseEntity<BaseResponse<AccountRecord>> res = handle(validRequest());

        assertServerError(res);
        verifyNoInteractions(accountCreator);
    }

    @Test
    void returns500WhenAccountCreatorThrows() {
        when(emailValidator.isValid("any_email@mail.com")).thenReturn(true);
        when(accountCreator.add(any())).thenThrow(new IllegalStateException("db down"));

        ResponseEntity<BaseResponse<AccountRecord>> res = handle(validRequest());

        assertServerError(res);
        assertThat(res.getBody().getMessage()).doesNotContain("db down");
    }

    @Test
    void returns200WithCreatedAccount() {
        when(emailValidator.isValid("any_email@mail.com")).thenReturn(true);
        when(accountCreator.add(any())).thenReturn(ACCOUNT);

        ResponseEntity<BaseResponse<AccountRecord>> res = handle(validRequest());

        assertThat(res.getStatusCode().value()).isEqualTo(200);
        assertThat(res.getBody().isSuccess()).isTrue();
        assertThat(res.getBody().getKind()).isNull();
        assertThat(res.getBody().getResult()).isEqualTo(ACCOUNT);
    }

    @Test
    void returnsEqualResponsesForRepeatedCalls() {
        when(emailValidator.isValid("invalid_email@mail.com")).thenReturn(false);
        SignupRequest req = new SignupRequest("any_name", "invalid_email@mail.com", "any_password", "any_password");

        ResponseEntity<BaseResponse<AccountRecord>> first = handle(req);
        ResponseEntity<BaseResponse<AccountRecord>> second = handle(req);

        assertThat(second.getStatusCode()).isEqualTo(first.getStatusCode());
        assertThat(second.getBody()).isEqualTo(first.getBody());
    }

    @Test
    void rejectsNullCollaborators() {
        assertThatThrownBy(() -> new SignUpRequestHandler(null, accountCreator))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new SignUpRequestHandler(emailValidator, null))
                .isInstanceOf(NullPointerException.class);
    }

    private ResponseEntity<BaseResponse<AccountRecord>> handle(SignupRequest req) {
        return handler.handle(new HttpRequest<>(req));
    }

    private static SignupRequest validRequest() {
        return new SignupRequest("any_name", "any_email@mail.com", "any_password", "any_password");
    }

    private static void assertMissingParam(ResponseEntity<BaseResponse<AccountRecord>> res, String field) {
        assertThat(res.getStatusCode().value()).isEqualTo(400);
        assertThat(res.getBody().getKind()).isEqualTo("MissingParam");
        assertThat(res.getBody().getField()).isEqualTo(field);
        assertThat(res.getBody().getResult()).isNull();
    }

    private static void assertInvalidParam(ResponseEntity<BaseResponse<AccountRecord>> res, String field) {
        assertThat(res.getStatusCode().value()).isEqualTo(400);
        assertThat(res.getBody().getKind()).isEqualTo("InvalidParam");
        assertThat(res.getBody().getField()).isEqualTo(field);
    }

    private static void assertServerError(ResponseEntity<BaseResponse<AccountRecord>> res) {
        assertThat(res.getStatusCode().value()).isEqualTo(500);
        assertThat(res.getBody().getKind()).isEqualTo("ServerError");
        assertThat(res.getBody().getField()).isNull();
        assertThat(res.getBody().getMessage()).isEqualTo(BaseResponseStatus.SERVER_ERROR.getMessage());
    }
}
