package com.codeheadsystems.tether.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Credentials submitted from a front end's login form.
 * <p>
 * Used by: {@code POST /auth/login}
 *
 * @param username the account name
 * @param password the plaintext password, only ever compared server-side against the stored hash
 */
public record LoginRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "LoginRequest[username=" + username + "]";
  }
}
