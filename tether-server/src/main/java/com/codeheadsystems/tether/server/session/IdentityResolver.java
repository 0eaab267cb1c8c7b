package com.codeheadsystems.tether.server.session;

import com.codeheadsystems.tether.server.model.ProcessLocalIdentity;
import com.codeheadsystems.tether.server.model.SessionRecord;
import com.codeheadsystems.tether.server.store.SessionStore;
import com.codeheadsystems.tether.server.store.SessionTokens;
import com.codeheadsystems.tether.server.store.StoreUnavailableException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Works out who the caller is at the start of every page load.
 * <p>
 * Tiers are consulted in order; every candidate is validated against the shared
 * {@link SessionStore}, including one the process already cached. A candidate that does not
 * resolve is reported stale and the next tier is tried. The first valid session wins and is
 * touched, and later tiers are told they were bypassed. If the store is unreachable the identity
 * is left anonymous and the {@link StoreUnavailableException} propagates.
 */
public class IdentityResolver {

  private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

  private final SessionStore sessionStore;
  private final List<SessionLookupStrategy> strategies;

  public IdentityResolver(SessionStore sessionStore, List<SessionLookupStrategy> strategies) {
    this.sessionStore = sessionStore;
    this.strategies = List.copyOf(strategies);
  }

  /**
   * The standard three tiers: process cache, then link parameter, then cookie.
   */
  public static List<SessionLookupStrategy> defaultStrategies(SessionPropagator propagator,
                                                              Clock clock) {
    return List.of(
        new CachedSessionLookup(),
        new LinkParameterLookup(propagator, clock),
        new CookieLookup(propagator));
  }

  /**
   * Resolves the request's identity and publishes the outcome on it.
   * <p>
   * The outcome is built for this request alone and published in one step, so concurrent requests
   * from the same browser keep seeing the previous state until then. If another request published
   * a newer state in the meantime (a login, say), that state is kept.
   *
   * @param request the inbound page request
   * @return the request's identity, now AUTHENTICATED or ANONYMOUS
   * @throws StoreUnavailableException if the session store cannot be reached
   */
  public ProcessLocalIdentity resolve(PageRequest request) {
    ProcessLocalIdentity identity = request.identity();
    ProcessLocalIdentity.Snapshot observed = identity.beginResolving();
    try {
      identity.publish(observed, resolveSnapshot(request));
      return identity;
    } catch (StoreUnavailableException e) {
      identity.publish(observed, ProcessLocalIdentity.Snapshot.ANONYMOUS);
      throw e;
    }
  }

  private ProcessLocalIdentity.Snapshot resolveSnapshot(PageRequest request) {
    for (int i = 0; i < strategies.size(); i++) {
      SessionLookupStrategy strategy = strategies.get(i);
      Optional<String> candidate = strategy.lookup(request);
      if (candidate.isEmpty()) {
        continue;
      }
      String sessionId = candidate.get();
      Optional<SessionRecord> session = sessionStore.get(sessionId);
      if (session.isEmpty()) {
        log.debug("Stale session {} from {}", SessionTokens.prefix(sessionId), strategy.name());
        strategy.onStale(request);
        continue;
      }
      SessionRecord record = session.get();
      sessionStore.touch(record.sessionId());
      strategy.onResolved(request, record);
      for (SessionLookupStrategy bypassed : strategies.subList(i + 1, strategies.size())) {
        bypassed.onBypassed(request);
      }
      if (strategy instanceof CachedSessionLookup) {
        log.debug("Session {} revalidated for {}", SessionTokens.prefix(sessionId), record.username());
      } else {
        log.info("Session restored for {} via {}", record.username(), strategy.name());
      }
      return ProcessLocalIdentity.Snapshot.authenticated(record.sessionId(), record.profile());
    }
    return ProcessLocalIdentity.Snapshot.ANONYMOUS;
  }
}
