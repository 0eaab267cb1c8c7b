package com.codeheadsystems.tether.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a registration.
 *
 * @param success whether the account was created
 * @param reason  machine-readable failure reason ({@code USERNAME_TAKEN}, {@code EMAIL_TAKEN},
 *                {@code INVALID_INPUT}), {@code null} on success
 * @param message user-facing message
 */
public record RegisterResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("reason") String reason,
    @JsonProperty("message") String message) {
}
