package com.codeheadsystems.tether.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The caller's identity as seen by the front end that served the request.
 *
 * @param authenticated      whether a valid session was found
 * @param username           account name, {@code null} when anonymous
 * @param displayName        display name, {@code null} when anonymous
 * @param email              email, {@code null} when anonymous
 * @param role               role name; {@code public} when anonymous
 * @param subscriptionTier   {@code free}, {@code pro} or {@code enterprise}
 * @param subscriptionStatus {@code active} or {@code inactive}
 */
public record UserProfileResponse(
    @JsonProperty("authenticated") boolean authenticated,
    @JsonProperty("username") String username,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("email") String email,
    @JsonProperty("role") String role,
    @JsonProperty("subscriptionTier") String subscriptionTier,
    @JsonProperty("subscriptionStatus") String subscriptionStatus) {

  /**
   * Profile returned to callers without a session.
   *
   * @return the anonymous profile
   */
  public static UserProfileResponse anonymous() {
    return new UserProfileResponse(false, null, null, null, "public", "free", "inactive");
  }
}
