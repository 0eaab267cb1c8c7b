package com.codeheadsystems.tether.server.store;

import com.codeheadsystems.tether.server.model.SessionRecord;
import com.codeheadsystems.tether.server.model.UserProfile;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired sessions are lazily evicted on {@link #get}. Sessions are visible to this process only
 * and are lost on restart, so front ends using it do not share a login. Suitable for development
 * and testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, SessionRecord> store = new ConcurrentHashMap<>();
  private final SessionTokens tokens;
  private final Duration ttl;
  private final Clock clock;

  public InMemorySessionStore(SessionTokens tokens, Duration ttl, Clock clock) {
    this.tokens = tokens;
    this.ttl = ttl;
    this.clock = clock;
    log.warn("InMemorySessionStore in use: sessions are not shared between processes");
  }

  @Override
  public SessionRecord create(String username, UserProfile profile) {
    Instant now = clock.instant();
    SessionRecord record = new SessionRecord(tokens.next(), profile, now, now, now.plus(ttl));
    store.put(record.sessionId(), record);
    log.debug("Stored session {} for {}", SessionTokens.prefix(record.sessionId()), username);
    return record;
  }

  @Override
  public Optional<SessionRecord> get(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    SessionRecord record = store.get(sessionId);
    if (record == null) {
      return Optional.empty();
    }
    if (!record.isValidAt(clock.instant())) {
      store.remove(sessionId, record);
      return Optional.empty();
    }
    return Optional.of(record);
  }

  @Override
  public void touch(String sessionId) {
    Instant now = clock.instant();
    store.computeIfPresent(sessionId, (id, r) ->
        new SessionRecord(id, r.profile(), r.createdAt(), now, r.expiresAt()));
  }

  @Override
  public void delete(String sessionId) {
    if (sessionId != null) {
      store.remove(sessionId);
    }
  }

  @Override
  public int deleteByUsername(String username) {
    int removed = 0;
    for (SessionRecord r : store.values()) {
      if (r.username().equals(username) && store.remove(r.sessionId(), r)) {
        removed++;
      }
    }
    log.debug("Deleted {} session(s) for {}", removed, username);
    return removed;
  }

  @Override
  public int sweepExpired() {
    Instant now = clock.instant();
    int removed = 0;
    for (SessionRecord r : store.values()) {
      if (!r.isValidAt(now) && store.remove(r.sessionId(), r)) {
        removed++;
      }
    }
    return removed;
  }

  @Override
  public long countActive() {
    Instant now = clock.instant();
    return store.values().stream().filter(r -> r.isValidAt(now)).count();
  }
}
