package com.codeheadsystems.tether.dropwizard;

import com.codeheadsystems.tether.dropwizard.auth.TetherAuthFilter;
import com.codeheadsystems.tether.dropwizard.auth.TetherAuthenticator;
import com.codeheadsystems.tether.dropwizard.auth.TetherAuthorizer;
import com.codeheadsystems.tether.dropwizard.auth.TetherPrincipal;
import com.codeheadsystems.tether.dropwizard.health.SessionStoreHealthCheck;
import com.codeheadsystems.tether.dropwizard.lifecycle.ManagedSessionSweeper;
import com.codeheadsystems.tether.dropwizard.session.SessionResolutionFilter;
import com.codeheadsystems.tether.server.auth.Argon2Settings;
import com.codeheadsystems.tether.server.auth.PasswordVerifier;
import com.codeheadsystems.tether.server.manager.AuthService;
import com.codeheadsystems.tether.server.manager.EntitlementGate;
import com.codeheadsystems.tether.server.resource.AuthResource;
import com.codeheadsystems.tether.server.session.IdentityResolver;
import com.codeheadsystems.tether.server.session.SessionPropagator;
import com.codeheadsystems.tether.server.session.SessionSweeper;
import com.codeheadsystems.tether.server.store.CredentialStore;
import com.codeheadsystems.tether.server.store.SessionStore;
import com.codeheadsystems.tether.server.store.SessionTokens;
import com.codeheadsystems.tether.server.store.SqliteSessionStore;
import com.codeheadsystems.tether.server.store.YamlCredentialStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import org.eclipse.jetty.server.session.SessionHandler;
import org.glassfish.jersey.server.filter.RolesAllowedDynamicFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that joins a front end to the shared Tether login.
 * <p>
 * Registers the {@code /auth} resource, the per-request session resolution filter, the
 * {@code @Auth TetherPrincipal} / {@code @RolesAllowed} support, the store exception mapper, a
 * health check and the expired-session sweeper. Requires a {@link TetherConfiguration} block in
 * the application's YAML config.
 * <p>
 * Stores built from the configuration (credential YAML file and SQLite session database):
 * <pre>{@code
 *   bootstrap.addBundle(new TetherBundle<>());
 * }</pre>
 * <p>
 * Or supply your own stores:
 * <pre>{@code
 *   bootstrap.addBundle(new TetherBundle<>(myCredentialStore, mySessionStore));
 * }</pre>
 * Pages get the {@link AuthService} from {@link #getAuthService()} once the bundle has run.
 */
public class TetherBundle<C extends TetherConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(TetherBundle.class);

  private final CredentialStore suppliedCredentialStore;
  private final SessionStore suppliedSessionStore;
  private final Clock clock;

  private String applicationName = "tether";
  private AuthService authService;
  private SessionStore sessionStore;
  private SessionHandler servletSessionHandler;

  /**
   * Creates a bundle whose stores are opened from the configured files.
   */
  public TetherBundle() {
    this(null, null);
  }

  /**
   * Creates a bundle backed by the supplied stores; the store paths in the configuration are
   * then ignored.
   */
  public TetherBundle(CredentialStore credentialStore, SessionStore sessionStore) {
    this.suppliedCredentialStore = credentialStore;
    this.suppliedSessionStore = sessionStore;
    this.clock = Clock.systemUTC();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    applicationName = bootstrap.getApplication().getName();
  }

  @Override
  public void run(C configuration, Environment environment) {
    SecureRandom random = new SecureRandom();
    Duration ttl = Duration.ofSeconds(configuration.getSessionTtlSeconds());
    CredentialStore credentialStore = suppliedCredentialStore != null
        ? suppliedCredentialStore
        : new YamlCredentialStore(Path.of(configuration.getCredentialFile()));
    sessionStore = suppliedSessionStore != null
        ? suppliedSessionStore
        : new SqliteSessionStore(Path.of(configuration.getSessionDatabase()),
            Duration.ofMillis(configuration.getBusyTimeoutMillis()), new SessionTokens(random), ttl, clock);

    PasswordVerifier passwordVerifier = new PasswordVerifier(argon2Settings(configuration), random);
    SessionPropagator propagator =
        new SessionPropagator(configuration.getCookieName(), configuration.getLinkParameter());
    IdentityResolver resolver =
        new IdentityResolver(sessionStore, IdentityResolver.defaultStrategies(propagator, clock));
    EntitlementGate entitlementGate = new EntitlementGate();
    authService = new AuthService(credentialStore, sessionStore, passwordVerifier, resolver,
        propagator, entitlementGate, clock);

    // The process-local identity is kept in the servlet session.
    servletSessionHandler = servletSessionHandler(configuration, applicationName);
    environment.servlets().setSessionHandler(servletSessionHandler);
    environment.jersey().register(new SessionResolutionFilter(authService, configuration.isSecureCookie()));
    environment.jersey().register(new StoreUnavailableExceptionMapper());
    environment.jersey().register(new AuthResource(authService));

    environment.jersey().register(new AuthDynamicFeature(
        new TetherAuthFilter.Builder()
            .setAuthenticator(new TetherAuthenticator())
            .setAuthorizer(new TetherAuthorizer(entitlementGate))
            .setPrefix("Session")
            .setRealm("tether")
            .buildAuthFilter()));
    environment.jersey().register(RolesAllowedDynamicFeature.class);
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(TetherPrincipal.class));

    environment.healthChecks().register("session-store", new SessionStoreHealthCheck(sessionStore));
    if (configuration.getSweepIntervalSeconds() > 0) {
      environment.lifecycle().manage(new ManagedSessionSweeper(
          new SessionSweeper(sessionStore, Duration.ofSeconds(configuration.getSweepIntervalSeconds()))));
    } else {
      log.warn("Session sweeper disabled; expired sessions are only removed when looked up");
    }
    if (!configuration.isSecureCookie()) {
      log.warn("Session cookie is not marked Secure. Enable secureCookie when serving over HTTPS.");
    }
  }

  /**
   * Servlet session handler for the process-local identity cache: idle sessions expire and the
   * cookie name is specific to this application.
   */
  static SessionHandler servletSessionHandler(TetherConfiguration configuration, String applicationName) {
    SessionHandler handler = new SessionHandler();
    handler.setMaxInactiveInterval(configuration.getServletSessionIdleSeconds());
    String cookieName = configuration.getServletSessionCookieName() != null
        ? configuration.getServletSessionCookieName()
        : applicationName.replaceAll("[^A-Za-z0-9]", "_").toUpperCase(Locale.ROOT) + "_JSESSIONID";
    handler.getSessionCookieConfig().setName(cookieName);
    handler.getSessionCookieConfig().setHttpOnly(true);
    handler.getSessionCookieConfig().setSecure(configuration.isSecureCookie());
    log.info("Servlet session cookie {} (idle timeout {}s)", cookieName,
        configuration.getServletSessionIdleSeconds());
    return handler;
  }

  public static Argon2Settings argon2Settings(TetherConfiguration configuration) {
    return new Argon2Settings(configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(),
        configuration.getArgon2Parallelism());
  }

  /**
   * The service built by {@link #run}; null before the application has started.
   */
  public AuthService getAuthService() {
    return authService;
  }

  /**
   * The servlet session handler installed by {@link #run}; null before the application has started.
   */
  public SessionHandler getServletSessionHandler() {
    return servletSessionHandler;
  }

  /**
   * The session store in use; null before the application has started.
   */
  public SessionStore getSessionStore() {
    return sessionStore;
  }
}
