package com.codeheadsystems.tether.server.model;

import java.util.Locale;

/**
 * Subscription status as resolved by the billing system. Stored, never computed here.
 */
public enum SubscriptionStatus {
  ACTIVE("active"),
  INACTIVE("inactive");

  private final String wireName;

  SubscriptionStatus(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Parses a stored status name; anything missing or unknown is {@link #INACTIVE}.
   */
  public static SubscriptionStatus fromName(String name) {
    if (name != null && ACTIVE.wireName.equals(name.trim().toLowerCase(Locale.ROOT))) {
      return ACTIVE;
    }
    return INACTIVE;
  }

  public String wireName() {
    return wireName;
  }
}
