package com.codeheadsystems.tether.server.model;

/**
 * Result of {@code AuthService.login}.
 *
 * @param success whether a session was issued
 * @param message user-facing message
 */
public record LoginResult(boolean success, String message) {

  public static final String INVALID_CREDENTIALS = "invalid username or password";
  public static final String MISSING_CREDENTIALS = "Username and password are required";

  public static LoginResult failure(String message) {
    return new LoginResult(false, message);
  }

  public static LoginResult welcome(String displayName) {
    return new LoginResult(true, "Welcome back, " + displayName + "!");
  }
}
