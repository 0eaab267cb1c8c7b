package com.codeheadsystems.tether.server.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A row of the shared session table.
 *
 * @param sessionId      opaque random token, global primary key
 * @param profile        identity snapshot taken when the session was created
 * @param createdAt      creation time
 * @param lastAccessedAt last successful resolution by any front end
 * @param expiresAt      creation time plus the session TTL
 */
public record SessionRecord(
    String sessionId,
    UserProfile profile,
    Instant createdAt,
    Instant lastAccessedAt,
    Instant expiresAt) {

  /**
   * A session is valid iff it expires strictly after {@code now}.
   */
  public boolean isValidAt(Instant now) {
    return expiresAt.isAfter(now);
  }

  /**
   * Lifetime left at {@code now}, never negative.
   */
  public Duration remainingAt(Instant now) {
    Duration remaining = Duration.between(now, expiresAt);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  public String username() {
    return profile.username();
  }
}
