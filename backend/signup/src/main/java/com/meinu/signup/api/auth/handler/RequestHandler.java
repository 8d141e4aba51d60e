package com.meinu.signup.api.auth.handler;

import com.meinu.signup.global.common.base.BaseResponse;
import org.springframework.http.ResponseEntity;

/**
 * Transport-agnostic request handler. Implementations report every outcome through the returned
 * response and never throw.
 */
public interface RequestHandler<T, R> {
    ResponseEntity<BaseResponse<R>> handle(HttpRequest<T> request);
}
