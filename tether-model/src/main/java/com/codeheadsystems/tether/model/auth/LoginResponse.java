package com.codeheadsystems.tether.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a login attempt.
 * <p>
 * Failures never say whether the username or the password was wrong.
 *
 * @param success whether a session was issued
 * @param message user-facing message, e.g. {@code "Welcome back, Alice!"}
 */
public record LoginResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message) {
}
