package com.meinu.signup.api.auth.usecase;

/**
 * Creates and persists a new account.
 * <p>
 * Implementations may throw any {@link RuntimeException}; callers treat every failure as a server error.
 */
public interface AccountCreator {
    AccountRecord add(AccountInput input);
}
