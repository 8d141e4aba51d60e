package com.meinu.signup.api.auth.usecase;

public record AccountRecord(Long id, String name, String email) {
}
