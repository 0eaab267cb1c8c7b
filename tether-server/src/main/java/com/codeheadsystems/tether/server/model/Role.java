package com.codeheadsystems.tether.server.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordinal role scale shared by every front end.
 * <p>
 * A higher rank includes everything a lower rank may see. The historical names
 * {@code anonymous} and {@code registered} are accepted as aliases of {@link #PUBLIC} and
 * {@link #USER}.
 */
public enum Role {
  PUBLIC(0, "public", "anonymous"),
  USER(1, "user", "registered"),
  SUBSCRIBER(2, "subscriber", null),
  ADMIN(3, "admin", null),
  SUPERADMIN(4, "superadmin", null);

  private final int rank;
  private final String wireName;
  private final String alias;

  Role(int rank, String wireName, String alias) {
    this.rank = rank;
    this.wireName = wireName;
    this.alias = alias;
  }

  /**
   * Looks up a role by its stored name or alias, ignoring case.
   *
   * @param name the role name, may be null
   * @return the role, or empty if the name is not recognized
   */
  public static Optional<Role> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (Role role : values()) {
      if (role.wireName.equals(normalized) || normalized.equals(role.alias)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }

  public int rank() {
    return rank;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * True if this role ranks at or above the given one.
   */
  public boolean includes(Role other) {
    return rank >= other.rank;
  }
}
