package com.codeheadsystems.tether.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Self-service registration form.
 * <p>
 * Used by: {@code POST /auth/register}
 *
 * @param username    unique, immutable account name
 * @param password    plaintext password; hashed before it is stored
 * @param email       contact address, unique across all accounts
 * @param displayName name shown in greetings
 * @param role        requested role; {@code null} means {@code user}
 */
public record RegisterRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password,
    @JsonProperty("email") String email,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("role") String role) {

  @Override
  public String toString() {
    return "RegisterRequest[username=" + username + ", email=" + email + ", role=" + role + "]";
  }
}
