package com.codeheadsystems.tether.server.session;

import java.util.Optional;

/**
 * Third tier: the long-lived browser cookie. A stale cookie is cleared.
 */
public class CookieLookup implements SessionLookupStrategy {

  private final SessionPropagator propagator;

  public CookieLookup(SessionPropagator propagator) {
    this.propagator = propagator;
  }

  @Override
  public String name() {
    return "cookie";
  }

  @Override
  public Optional<String> lookup(PageRequest request) {
    return request.cookie(propagator.cookieName()).filter(s -> !s.isBlank());
  }

  @Override
  public void onStale(PageRequest request) {
    propagator.clearCookie(request);
  }
}
