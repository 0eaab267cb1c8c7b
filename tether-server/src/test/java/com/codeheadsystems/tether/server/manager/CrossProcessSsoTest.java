package com.codeheadsystems.tether.server.manager;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tether.server.model.UserProfile;
import com.codeheadsystems.tether.server.testing.FakePageRequest;
import com.codeheadsystems.tether.server.testing.FrontEndProcess;
import com.codeheadsystems.tether.server.testing.MutableClock;
import java.net.URI;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Two front ends over the same credential file and session database.
 */
class CrossProcessSsoTest {

  @TempDir
  Path tempDir;

  private AuthService app1;
  private AuthService app2;

  @BeforeEach
  void setUp() {
    MutableClock clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
    Path credentials = tempDir.resolve("credentials.yaml");
    Path sessions = tempDir.resolve("sessions.db");
    app1 = FrontEndProcess.start(credentials, sessions, clock);
    app2 = FrontEndProcess.start(credentials, sessions, clock);
  }

  @Test
  void linkFromOneProcess_resolvesSameUserInAnother() {
    app1.register("alice", "correct-horse", "a@x.com", "Alice", "subscriber");
    FakePageRequest onApp1 = new FakePageRequest();
    app1.login(onApp1, "alice", "correct-horse");

    String link = app1.embedInLink(onApp1, "http://app2/");
    String sessionId = URI.create(link).getQuery().substring("sessionId=".length());

    FakePageRequest onApp2 = FakePageRequest.freshBrowser().withQueryParameter("sessionId", sessionId);
    app2.resolve(onApp2);

    assertThat(app2.currentUser(onApp2)).map(UserProfile::username).contains("alice");
    assertThat(onApp2.wasStripped("sessionId")).isTrue();
    assertThat(onApp2.cookieJar()).containsValue(sessionId);
  }

  @Test
  void cookieFromOneProcess_resolvesInAnother() {
    app1.register("bob", "pw", "bob@example.com", "Bob");
    FakePageRequest browser = new FakePageRequest();
    app1.login(browser, "bob", "pw");

    FakePageRequest onApp2 = browser.otherProcess();
    app2.resolve(onApp2);

    assertThat(app2.isAuthenticated(onApp2)).isTrue();
  }

  @Test
  void logoutInOneProcess_isSeenByAnother() {
    app1.register("bob", "pw", "bob@example.com", "Bob");
    FakePageRequest browser = new FakePageRequest();
    app1.login(browser, "bob", "pw");
    FakePageRequest onApp2 = browser.otherProcess();
    app2.resolve(onApp2);
    assertThat(app2.isAuthenticated(onApp2)).isTrue();

    app1.logout(browser.nextPage());

    // app2 still has the session cached in-process; the next page load revalidates it
    FakePageRequest onApp2Again = onApp2.nextPage();
    app2.resolve(onApp2Again);
    assertThat(app2.isAuthenticated(onApp2Again)).isFalse();
    FakePageRequest onApp1Again = browser.nextPage();
    app1.resolve(onApp1Again);
    assertThat(app1.isAuthenticated(onApp1Again)).isFalse();
  }

  @Test
  void registrationInOneProcess_allowsLoginInAnother() {
    app1.register("carol", "pw", "carol@example.com", "Carol");

    assertThat(app2.login(new FakePageRequest(), "carol", "pw").success()).isTrue();
    assertThat(app2.register("carol", "pw2", "c2@example.com", "Carol 2").success()).isFalse();
  }
}
