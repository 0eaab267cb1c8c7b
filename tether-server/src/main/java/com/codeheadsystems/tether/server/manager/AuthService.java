package com.codeheadsystems.tether.server.manager;

import com.codeheadsystems.tether.server.auth.PasswordVerifier;
import com.codeheadsystems.tether.server.model.LoginResult;
import com.codeheadsystems.tether.server.model.ProcessLocalIdentity;
import com.codeheadsystems.tether.server.model.RegistrationResult;
import com.codeheadsystems.tether.server.model.Role;
import com.codeheadsystems.tether.server.model.SessionRecord;
import com.codeheadsystems.tether.server.model.UserCredential;
import com.codeheadsystems.tether.server.model.UserProfile;
import com.codeheadsystems.tether.server.session.IdentityResolver;
import com.codeheadsystems.tether.server.session.PageRequest;
import com.codeheadsystems.tether.server.session.SessionPropagator;
import com.codeheadsystems.tether.server.store.CredentialStore;
import com.codeheadsystems.tether.server.store.InsertOutcome;
import com.codeheadsystems.tether.server.store.SessionStore;
import com.codeheadsystems.tether.server.store.StoreUnavailableException;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic entry point that every page calls.
 * <p>
 * Built once per process and handed to request handlers. Every page load calls
 * {@link #resolve} first; the remaining read methods only consult the identity that call left
 * behind. {@link StoreUnavailableException} is never converted into an anonymous or
 * authenticated answer; adapters map it to an error response.
 */
public class AuthService {

  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  private final CredentialStore credentialStore;
  private final SessionStore sessionStore;
  private final PasswordVerifier passwordVerifier;
  private final IdentityResolver identityResolver;
  private final SessionPropagator sessionPropagator;
  private final EntitlementGate entitlementGate;
  private final Clock clock;

  public AuthService(CredentialStore credentialStore,
                     SessionStore sessionStore,
                     PasswordVerifier passwordVerifier,
                     IdentityResolver identityResolver,
                     SessionPropagator sessionPropagator,
                     EntitlementGate entitlementGate,
                     Clock clock) {
    this.credentialStore = credentialStore;
    this.sessionStore = sessionStore;
    this.passwordVerifier = passwordVerifier;
    this.identityResolver = identityResolver;
    this.sessionPropagator = sessionPropagator;
    this.entitlementGate = entitlementGate;
    this.clock = clock;
  }

  /**
   * Resolves the caller's identity. Call once at the start of every request.
   *
   * @throws StoreUnavailableException if the session store cannot be reached
   */
  public ProcessLocalIdentity resolve(PageRequest request) {
    return identityResolver.resolve(request);
  }

  /**
   * Checks credentials and, on success, issues a session, sets the cookie and authenticates the
   * caller in this process. The failure message never says which part was wrong.
   *
   * @throws StoreUnavailableException if a store cannot be reached
   */
  public LoginResult login(PageRequest request, String username, String password) {
    if (isBlank(username) || isBlank(password)) {
      return LoginResult.failure(LoginResult.MISSING_CREDENTIALS);
    }
    String name = username.trim();
    Optional<UserCredential> found = credentialStore.findByUsername(name);
    if (found.isEmpty()) {
      passwordVerifier.burn(password);
      log.debug("login: unknown username");
      return LoginResult.failure(LoginResult.INVALID_CREDENTIALS);
    }
    UserCredential credential = found.get();
    PasswordVerifier.Verification verification = passwordVerifier.verify(password, credential.passwordHash());
    if (!verification.matched()) {
      log.debug("login: wrong password for {}", name);
      return LoginResult.failure(LoginResult.INVALID_CREDENTIALS);
    }
    if (verification == PasswordVerifier.Verification.MATCH_NEEDS_REHASH) {
      rehash(name, password);
    }
    UserProfile profile = credential.toProfile();
    SessionRecord session = sessionStore.create(name, profile);
    sessionPropagator.setCookie(request, session.sessionId(), session.remainingAt(clock.instant()));
    request.identity().authenticate(session.sessionId(), profile);
    log.info("Session created for {} (role={})", name, profile.role().wireName());
    return LoginResult.welcome(profile.displayName());
  }

  private void rehash(String username, String password) {
    try {
      if (credentialStore.updatePasswordHash(username, passwordVerifier.hash(password))) {
        log.info("Upgraded stored password hash for {} to Argon2id", username);
      }
    } catch (StoreUnavailableException e) {
      log.warn("Could not persist upgraded password hash for {}: {}", username, e.getMessage());
    }
  }

  /**
   * Ends the caller's current session everywhere it is shared, clears the cookie and leaves the
   * caller anonymous in this process.
   *
   * @throws StoreUnavailableException if the session store cannot be reached
   */
  public void logout(PageRequest request) {
    ProcessLocalIdentity identity = request.identity();
    ProcessLocalIdentity.Snapshot snapshot = identity.snapshot();
    Optional<String> sessionId = snapshot.sessionId();
    Optional<String> username = snapshot.profile().map(UserProfile::username);
    try {
      sessionId.ifPresent(sessionStore::delete);
    } finally {
      sessionPropagator.clearCookie(request);
      identity.demote();
    }
    username.ifPresent(u -> log.info("Logged out {}", u));
  }

  /**
   * Deletes every session of the caller's user, in every front end, then logs out.
   *
   * @return the number of sessions removed
   * @throws StoreUnavailableException if the session store cannot be reached
   */
  public int logoutEverywhere(PageRequest request) {
    ProcessLocalIdentity identity = request.identity();
    Optional<String> username = identity.profile().map(UserProfile::username);
    int removed = 0;
    try {
      if (username.isPresent()) {
        removed = sessionStore.deleteByUsername(username.get());
        log.info("Signed out {} everywhere ({} session(s))", username.get(), removed);
      }
    } finally {
      sessionPropagator.clearCookie(request);
      identity.demote();
    }
    return removed;
  }

  /**
   * Registers a user with the {@code user} role.
   */
  public RegistrationResult register(String username, String password, String email, String displayName) {
    return register(username, password, email, displayName, Role.USER.wireName());
  }

  /**
   * Self-service registration. A failed registration leaves every existing credential untouched.
   *
   * @throws StoreUnavailableException if the credential file cannot be written
   */
  public RegistrationResult register(String username, String password, String email,
                                     String displayName, String role) {
    if (isBlank(username) || isBlank(password) || isBlank(email)) {
      return RegistrationResult.failed(RegistrationResult.Failure.INVALID_INPUT);
    }
    Optional<Role> parsedRole = Role.fromName(role == null ? Role.USER.wireName() : role);
    if (parsedRole.isEmpty()) {
      return RegistrationResult.failed(RegistrationResult.Failure.INVALID_INPUT);
    }
    String name = username.trim();
    // insert() repeats both checks under the write lock.
    if (credentialStore.findByUsername(name).isPresent()) {
      return RegistrationResult.failed(RegistrationResult.Failure.USERNAME_TAKEN);
    }
    if (credentialStore.emailExists(email.trim())) {
      return RegistrationResult.failed(RegistrationResult.Failure.EMAIL_TAKEN);
    }
    UserCredential credential = UserCredential.newRegistration(
        name,
        isBlank(displayName) ? name : displayName.trim(),
        email.trim(),
        passwordVerifier.hash(password),
        parsedRole.get(),
        clock.instant());
    InsertOutcome outcome = credentialStore.insert(credential);
    switch (outcome) {
      case USERNAME_EXISTS:
        return RegistrationResult.failed(RegistrationResult.Failure.USERNAME_TAKEN);
      case EMAIL_EXISTS:
        return RegistrationResult.failed(RegistrationResult.Failure.EMAIL_TAKEN);
      default:
        log.info("Registered {} (role={})", name, parsedRole.get().wireName());
        return RegistrationResult.succeeded();
    }
  }

  public boolean isAuthenticated(PageRequest request) {
    return request.identity().isAuthenticated();
  }

  public Optional<UserProfile> currentUser(PageRequest request) {
    return request.identity().profile();
  }

  /**
   * Whether the caller's role meets {@code requiredLevel}. Anonymous callers have role public.
   */
  public boolean hasAccess(PageRequest request, String requiredLevel) {
    return entitlementGate.hasAccess(request.identity().role(), requiredLevel);
  }

  /**
   * The link to render for a sibling front end, carrying the session if the caller has one.
   */
  public String embedInLink(PageRequest request, String url) {
    return sessionPropagator.embedInLink(url, request.identity());
  }

  public EntitlementGate entitlementGate() {
    return entitlementGate;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
