package com.codeheadsystems.tether.server.model;

import java.time.Instant;

/**
 * One registered human, as held by the credential registry.
 *
 * @param username           unique key, immutable once created
 * @param displayName        name shown in greetings
 * @param email              unique across all credentials
 * @param passwordHash       Argon2id PHC string, or a legacy value awaiting rehash
 * @param role               assigned role
 * @param subscriptionTier   stored tier
 * @param subscriptionStatus stored status
 * @param createdAt          registration time, may be null for hand-edited entries
 */
public record UserCredential(
    String username,
    String displayName,
    String email,
    String passwordHash,
    Role role,
    SubscriptionTier subscriptionTier,
    SubscriptionStatus subscriptionStatus,
    Instant createdAt) {

  /**
   * A new self-registered credential with the default free/inactive subscription.
   */
  public static UserCredential newRegistration(String username, String displayName, String email,
                                               String passwordHash, Role role, Instant createdAt) {
    return new UserCredential(username, displayName, email, passwordHash, role,
        SubscriptionTier.FREE, SubscriptionStatus.INACTIVE, createdAt);
  }

  /**
   * Copy with a replaced password hash.
   */
  public UserCredential withPasswordHash(String newHash) {
    return new UserCredential(username, displayName, email, newHash, role,
        subscriptionTier, subscriptionStatus, createdAt);
  }

  /**
   * The profile snapshot denormalized into every session created for this user.
   */
  public UserProfile toProfile() {
    String name = displayName == null || displayName.isBlank() ? username : displayName;
    return new UserProfile(username, name, email == null ? "" : email, role,
        subscriptionTier, subscriptionStatus);
  }

  @Override
  public String toString() {
    return "UserCredential[username=" + username + ", email=" + email + ", role=" + role + "]";
  }
}
