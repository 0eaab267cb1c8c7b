package com.codeheadsystems.tether.server.testing;

import com.codeheadsystems.tether.server.auth.Argon2Settings;
import com.codeheadsystems.tether.server.auth.PasswordVerifier;
import com.codeheadsystems.tether.server.manager.AuthService;
import com.codeheadsystems.tether.server.manager.EntitlementGate;
import com.codeheadsystems.tether.server.session.IdentityResolver;
import com.codeheadsystems.tether.server.session.SessionPropagator;
import com.codeheadsystems.tether.server.store.SessionTokens;
import com.codeheadsystems.tether.server.store.SqliteSessionStore;
import com.codeheadsystems.tether.server.store.YamlCredentialStore;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;

/**
 * Builds an {@link AuthService} the way a front-end process would at start-up, over shared
 * credential and session files. Two instances over the same files behave like two processes.
 */
public final class FrontEndProcess {

  public static final Duration TTL = Duration.ofDays(30);

  private FrontEndProcess() {
  }

  public static AuthService start(Path credentialsFile, Path sessionDb, MutableClock clock) {
    SecureRandom random = new SecureRandom();
    SqliteSessionStore sessions = new SqliteSessionStore(sessionDb, Duration.ofSeconds(5),
        new SessionTokens(random), TTL, clock);
    SessionPropagator propagator = new SessionPropagator();
    return new AuthService(
        new YamlCredentialStore(credentialsFile),
        sessions,
        new PasswordVerifier(new Argon2Settings(1024, 1, 1), random),
        new IdentityResolver(sessions, IdentityResolver.defaultStrategies(propagator, clock)),
        propagator,
        new EntitlementGate(),
        clock);
  }
}
