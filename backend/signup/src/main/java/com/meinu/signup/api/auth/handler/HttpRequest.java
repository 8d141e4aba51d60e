package com.meinu.signup.api.auth.handler;

public record HttpRequest<T>(T body) {
}
