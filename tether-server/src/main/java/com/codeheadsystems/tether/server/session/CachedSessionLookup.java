package com.codeheadsystems.tether.server.session;

import java.util.Optional;

/**
 * First tier: the session id this process already adopted for the browser. A stale one is
 * simply skipped; the resolution outcome replaces it.
 */
public class CachedSessionLookup implements SessionLookupStrategy {

  @Override
  public String name() {
    return "cache";
  }

  @Override
  public Optional<String> lookup(PageRequest request) {
    return request.identity().sessionId();
  }
}
