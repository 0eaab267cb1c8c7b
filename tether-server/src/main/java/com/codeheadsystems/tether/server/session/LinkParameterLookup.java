package com.codeheadsystems.tether.server.session;

import com.codeheadsystems.tether.server.model.SessionRecord;
import java.time.Clock;
import java.util.Optional;

/**
 * Second tier: a session id carried in on a link from a sibling front end.
 * <p>
 * The parameter is always removed from the visible URL. A valid one is also written to the
 * cookie so that later visits work without the link.
 */
public class LinkParameterLookup implements SessionLookupStrategy {

  private final SessionPropagator propagator;
  private final Clock clock;

  public LinkParameterLookup(SessionPropagator propagator, Clock clock) {
    this.propagator = propagator;
    this.clock = clock;
  }

  @Override
  public String name() {
    return "link";
  }

  @Override
  public Optional<String> lookup(PageRequest request) {
    return request.queryParameter(propagator.linkParameter()).filter(s -> !s.isBlank());
  }

  @Override
  public void onResolved(PageRequest request, SessionRecord session) {
    request.stripQueryParameter(propagator.linkParameter());
    propagator.setCookie(request, session.sessionId(), session.remainingAt(clock.instant()));
  }

  @Override
  public void onStale(PageRequest request) {
    request.stripQueryParameter(propagator.linkParameter());
  }

  @Override
  public void onBypassed(PageRequest request) {
    if (lookup(request).isPresent()) {
      request.stripQueryParameter(propagator.linkParameter());
    }
  }
}
