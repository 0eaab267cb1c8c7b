package com.codeheadsystems.tether.server.session;

import com.codeheadsystems.tether.server.model.SessionRecord;
import java.util.Optional;

/**
 * One tier of session discovery. {@link IdentityResolver} asks each tier in order for a
 * candidate session id and validates it against the session store.
 */
public interface SessionLookupStrategy {

  /**
   * Short name used in log lines.
   */
  String name();

  /**
   * Offers a candidate session id, if this tier has one.
   */
  Optional<String> lookup(PageRequest request);

  /**
   * Called when this tier's candidate resolved to a valid session.
   */
  default void onResolved(PageRequest request, SessionRecord session) {
  }

  /**
   * Called when this tier's candidate is unknown or expired.
   */
  default void onStale(PageRequest request) {
  }

  /**
   * Called when an earlier tier resolved the request, so this tier's candidate was never
   * consulted.
   */
  default void onBypassed(PageRequest request) {
  }
}
