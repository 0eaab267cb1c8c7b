package com.codeheadsystems.tether.server.model;

/**
 * Result of {@code AuthService.register}.
 *
 * @param success whether the credential was stored
 * @param failure why not, {@code null} on success
 */
public record RegistrationResult(boolean success, Failure failure) {

  private static final RegistrationResult SUCCESS = new RegistrationResult(true, null);

  public static RegistrationResult succeeded() {
    return SUCCESS;
  }

  public static RegistrationResult failed(Failure failure) {
    return new RegistrationResult(false, failure);
  }

  /**
   * Registration failure reasons surfaced to the user.
   */
  public enum Failure {
    USERNAME_TAKEN("That username is already taken"),
    EMAIL_TAKEN("That email address is already registered"),
    INVALID_INPUT("Username, password, email and a known role are required");

    private final String message;

    Failure(String message) {
      this.message = message;
    }

    public String message() {
      return message;
    }
  }
}
