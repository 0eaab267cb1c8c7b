package com.codeheadsystems.tether.server.model;

/**
 * Identity data copied into a session at creation time.
 *
 * @param username           account name
 * @param displayName        name shown in greetings
 * @param email              contact address
 * @param role               role at login time
 * @param subscriptionTier   tier at login time
 * @param subscriptionStatus status at login time
 */
public record UserProfile(
    String username,
    String displayName,
    String email,
    Role role,
    SubscriptionTier subscriptionTier,
    SubscriptionStatus subscriptionStatus) {
}
