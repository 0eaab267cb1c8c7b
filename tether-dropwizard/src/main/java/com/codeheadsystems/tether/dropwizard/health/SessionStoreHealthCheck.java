package com.codeheadsystems.tether.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tether.server.store.SessionStore;
import com.codeheadsystems.tether.server.store.StoreUnavailableException;

/**
 * Health check that verifies the shared session store answers queries.
 */
public class SessionStoreHealthCheck extends HealthCheck {

  private final SessionStore sessionStore;

  public SessionStoreHealthCheck(SessionStore sessionStore) {
    this.sessionStore = sessionStore;
  }

  @Override
  protected Result check() {
    try {
      return Result.healthy("active sessions=%d", sessionStore.countActive());
    } catch (StoreUnavailableException e) {
      return Result.unhealthy(e);
    }
  }
}
