package com.codeheadsystems.tether.server.model;

import java.util.Locale;

/**
 * Subscription tier as resolved by the billing system. Stored, never computed here.
 */
public enum SubscriptionTier {
  FREE("free"),
  PRO("pro"),
  ENTERPRISE("enterprise");

  private final String wireName;

  SubscriptionTier(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Parses a stored tier name; anything missing or unknown is {@link #FREE}.
   */
  public static SubscriptionTier fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      for (SubscriptionTier tier : values()) {
        if (tier.wireName.equals(normalized)) {
          return tier;
        }
      }
    }
    return FREE;
  }

  public String wireName() {
    return wireName;
  }
}
