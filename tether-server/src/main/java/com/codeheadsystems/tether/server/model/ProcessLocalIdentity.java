package com.codeheadsystems.tether.server.model;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * What one front-end process currently believes about one browser.
 * <p>
 * Holds a copy of session data only; the shared session store stays the source of truth and
 * the cached session id is re-validated on every request. Never persisted.
 * <p>
 * A browser may issue concurrent requests that share this object. Its state is a single
 * immutable {@link Snapshot}; a resolution pass works on its own result and publishes it in one
 * step, so other requests keep seeing the last published snapshot meanwhile. Callers that need
 * more than one field should read them from one {@link #snapshot()}.
 */
public class ProcessLocalIdentity {

  private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.UNRESOLVED);

  public Snapshot snapshot() {
    return current.get();
  }

  public IdentityState state() {
    return current.get().state();
  }

  public boolean isAuthenticated() {
    return current.get().isAuthenticated();
  }

  public Optional<String> sessionId() {
    return current.get().sessionId();
  }

  public Optional<UserProfile> profile() {
    return current.get().profile();
  }

  /**
   * The current role; {@link Role#PUBLIC} unless authenticated.
   */
  public Role role() {
    return current.get().role();
  }

  /**
   * Marks the start of a resolution pass and returns the snapshot the pass starts from.
   * <p>
   * Only a never-resolved identity moves to {@link IdentityState#RESOLVING}. A resolved one keeps
   * its published state until the pass finishes.
   */
  public Snapshot beginResolving() {
    current.compareAndSet(Snapshot.UNRESOLVED, Snapshot.RESOLVING);
    return current.get();
  }

  /**
   * Publishes the result of a resolution pass, unless another request published something newer
   * since {@code expected} was read.
   *
   * @return true if {@code next} is now the published snapshot
   */
  public boolean publish(Snapshot expected, Snapshot next) {
    return current.compareAndSet(expected, Objects.requireNonNull(next, "next"));
  }

  /**
   * Adopts a valid session.
   */
  public void authenticate(String sessionId, UserProfile profile) {
    current.set(Snapshot.authenticated(sessionId, profile));
  }

  /**
   * Forgets any session and becomes anonymous.
   */
  public void demote() {
    current.set(Snapshot.ANONYMOUS);
  }

  @Override
  public String toString() {
    Snapshot snapshot = current.get();
    return "ProcessLocalIdentity[state=" + snapshot.state()
        + ", username=" + snapshot.profile().map(UserProfile::username).orElse(null) + "]";
  }

  /**
   * One consistent view of the identity. An authenticated snapshot always carries both a
   * session id and a profile; no other state carries either.
   */
  public static final class Snapshot {

    static final Snapshot UNRESOLVED = new Snapshot(IdentityState.UNRESOLVED, null, null);
    static final Snapshot RESOLVING = new Snapshot(IdentityState.RESOLVING, null, null);
    public static final Snapshot ANONYMOUS = new Snapshot(IdentityState.ANONYMOUS, null, null);

    private final IdentityState state;
    private final String sessionId;
    private final UserProfile profile;

    private Snapshot(IdentityState state, String sessionId, UserProfile profile) {
      this.state = state;
      this.sessionId = sessionId;
      this.profile = profile;
    }

    public static Snapshot authenticated(String sessionId, UserProfile profile) {
      return new Snapshot(IdentityState.AUTHENTICATED,
          Objects.requireNonNull(sessionId, "sessionId"),
          Objects.requireNonNull(profile, "profile"));
    }

    public IdentityState state() {
      return state;
    }

    public boolean isAuthenticated() {
      return state == IdentityState.AUTHENTICATED;
    }

    public Optional<String> sessionId() {
      return Optional.ofNullable(sessionId);
    }

    public Optional<UserProfile> profile() {
      return Optional.ofNullable(profile);
    }

    public Role role() {
      return profile == null ? Role.PUBLIC : profile.role();
    }
  }
}
