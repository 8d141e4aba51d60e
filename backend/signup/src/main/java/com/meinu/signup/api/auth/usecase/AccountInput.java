package com.meinu.signup.api.auth.usecase;

public record AccountInput(String email, String name, String password) {
}
