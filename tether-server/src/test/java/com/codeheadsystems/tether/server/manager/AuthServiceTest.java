package com.codeheadsystems.tether.server.manager;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tether.server.model.LoginResult;
import com.codeheadsystems.tether.server.model.RegistrationResult;
import com.codeheadsystems.tether.server.model.Role;
import com.codeheadsystems.tether.server.model.UserCredential;
import com.codeheadsystems.tether.server.model.UserProfile;
import com.codeheadsystems.tether.server.session.SessionPropagator;
import com.codeheadsystems.tether.server.store.YamlCredentialStore;
import com.codeheadsystems.tether.server.testing.FakePageRequest;
import com.codeheadsystems.tether.server.testing.FrontEndProcess;
import com.codeheadsystems.tether.server.testing.MutableClock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Exercises the auth service over real credential and session files.
 */
class AuthServiceTest {

  @TempDir
  Path tempDir;

  private MutableClock clock;
  private Path credentials;
  private AuthService authService;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
    credentials = tempDir.resolve("credentials.yaml");
    authService = FrontEndProcess.start(credentials, tempDir.resolve("sessions.db"), clock);
  }

  /**
   * Register alice as a subscriber, fail once, log in, check her tier and entitlements.
   */
  @Test
  void aliceScenario() {
    assertThat(authService.register("alice", "correct-horse", "a@x.com", "Alice", "subscriber").success())
        .isTrue();
    FakePageRequest page = new FakePageRequest();
    authService.resolve(page);

    assertThat(authService.login(page, "alice", "wrong"))
        .isEqualTo(new LoginResult(false, "invalid username or password"));
    assertThat(authService.isAuthenticated(page)).isFalse();

    assertThat(authService.login(page, "alice", "correct-horse"))
        .isEqualTo(new LoginResult(true, "Welcome back, Alice!"));
    UserProfile alice = authService.currentUser(page).orElseThrow();
    assertThat(alice.subscriptionTier().wireName()).isEqualTo("free");
    assertThat(alice.role()).isEqualTo(Role.SUBSCRIBER);
    assertThat(authService.hasAccess(page, "admin")).isFalse();
    assertThat(authService.hasAccess(page, "subscriber")).isTrue();
    assertThat(page.cookieJar()).containsKey(SessionPropagator.DEFAULT_COOKIE_NAME);
  }

  @Test
  void login_unknownUser_hasSameMessageAsWrongPassword() {
    authService.register("bob", "pw", "bob@example.com", "Bob");

    LoginResult unknown = authService.login(new FakePageRequest(), "nobody", "pw");
    LoginResult wrong = authService.login(new FakePageRequest(), "bob", "nope");

    assertThat(unknown).isEqualTo(wrong);
    assertThat(unknown.message()).isEqualTo(LoginResult.INVALID_CREDENTIALS);
  }

  @Test
  void login_blankInput_isRejected() {
    assertThat(authService.login(new FakePageRequest(), " ", "pw").message())
        .isEqualTo("Username and password are required");
    assertThat(authService.login(new FakePageRequest(), "bob", null).success()).isFalse();
  }

  @Test
  void register_thenLogin_grantsRegisteredRole() {
    authService.register("carol", "pw", "carol@example.com", "Carol", "registered");
    FakePageRequest page = new FakePageRequest();

    assertThat(authService.login(page, "carol", "pw").success()).isTrue();
    assertThat(authService.currentUser(page)).map(UserProfile::role).contains(Role.USER);
  }

  @Test
  void register_defaultsToUserRoleAndDisplayNameToUsername() {
    authService.register("dave", "pw", "dave@example.com", null);
    FakePageRequest page = new FakePageRequest();
    authService.login(page, "dave", "pw");

    UserProfile dave = authService.currentUser(page).orElseThrow();
    assertThat(dave.role()).isEqualTo(Role.USER);
    assertThat(dave.displayName()).isEqualTo("dave");
  }

  @Test
  void register_duplicateUsername_leavesExistingRecordAlone() {
    authService.register("alice", "original", "a@x.com", "Alice", "subscriber");
    String before = new YamlCredentialStore(credentials).findByUsername("alice").orElseThrow().passwordHash();

    RegistrationResult again = authService.register("alice", "hijack", "other@x.com", "Mallory", "user");

    assertThat(again).isEqualTo(RegistrationResult.failed(RegistrationResult.Failure.USERNAME_TAKEN));
    UserCredential stored = new YamlCredentialStore(credentials).findByUsername("alice").orElseThrow();
    assertThat(stored.passwordHash()).isEqualTo(before);
    assertThat(stored.role()).isEqualTo(Role.SUBSCRIBER);
    assertThat(authService.login(new FakePageRequest(), "alice", "hijack").success()).isFalse();
  }

  @Test
  void register_duplicateEmail_isCaseInsensitive() {
    authService.register("alice", "pw", "A@X.com", "Alice");

    assertThat(authService.register("alice2", "pw", "a@x.COM", "Alice Two").failure())
        .isEqualTo(RegistrationResult.Failure.EMAIL_TAKEN);
  }

  @Test
  void register_invalidInput() {
    assertThat(authService.register("", "pw", "e@x.com", "E").failure())
        .isEqualTo(RegistrationResult.Failure.INVALID_INPUT);
    assertThat(authService.register("erin", "pw", "e@x.com", "Erin", "wizard").failure())
        .isEqualTo(RegistrationResult.Failure.INVALID_INPUT);
  }

  @Test
  void login_legacyPlainText_isRehashedToArgon2() throws IOException {
    Files.writeString(credentials, """
        credentials:
          usernames:
            legacy:
              name: Legacy
              email: legacy@example.com
              password: hunter2
              role: user
        """);

    assertThat(authService.login(new FakePageRequest(), "legacy", "hunter2").success()).isTrue();

    String stored = new YamlCredentialStore(credentials).findByUsername("legacy").orElseThrow().passwordHash();
    assertThat(stored).startsWith("$argon2id$");
    assertThat(authService.login(new FakePageRequest(), "legacy", "hunter2").success()).isTrue();
  }

  @Test
  void logout_clearsIdentityCookieAndSession() {
    authService.register("alice", "pw", "a@x.com", "Alice");
    FakePageRequest page = new FakePageRequest();
    authService.login(page, "alice", "pw");

    authService.logout(page);

    assertThat(authService.isAuthenticated(page)).isFalse();
    assertThat(page.cookieJar()).isEmpty();
    FakePageRequest next = page.nextPage();
    authService.resolve(next);
    assertThat(authService.isAuthenticated(next)).isFalse();
  }

  @Test
  void logoutEverywhere_endsAllSessionsOfUser() {
    authService.register("alice", "pw", "a@x.com", "Alice");
    FakePageRequest laptop = new FakePageRequest();
    FakePageRequest phone = FakePageRequest.freshBrowser();
    authService.login(laptop, "alice", "pw");
    authService.login(phone, "alice", "pw");

    assertThat(authService.logoutEverywhere(laptop)).isEqualTo(2);

    FakePageRequest phoneNext = phone.nextPage();
    authService.resolve(phoneNext);
    assertThat(authService.isAuthenticated(phoneNext)).isFalse();
  }

  @Test
  void expiredSession_resolvesAnonymousAndClearsCookie() {
    authService.register("alice", "pw", "a@x.com", "Alice");
    FakePageRequest page = new FakePageRequest();
    authService.login(page, "alice", "pw");
    clock.advance(FrontEndProcess.TTL.plus(Duration.ofMinutes(1)));

    FakePageRequest later = page.otherProcess();
    authService.resolve(later);

    assertThat(authService.isAuthenticated(later)).isFalse();
    assertThat(later.cookieJar()).isEmpty();
  }

  @Test
  void embedInLink_onlyForAuthenticatedCallers() {
    authService.register("alice", "pw", "a@x.com", "Alice");
    FakePageRequest page = new FakePageRequest();
    authService.resolve(page);
    assertThat(authService.embedInLink(page, "http://app2/")).isEqualTo("http://app2/");

    authService.login(page, "alice", "pw");

    assertThat(authService.embedInLink(page, "http://app2/")).startsWith("http://app2/?sessionId=");
  }
}
