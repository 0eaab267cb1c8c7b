package com.codeheadsystems.tether.server.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ProcessLocalIdentityTest {

  private static final UserProfile BOB = new UserProfile("bob", "Bob", "bob@example.com",
      Role.ADMIN, SubscriptionTier.ENTERPRISE, SubscriptionStatus.ACTIVE);

  @Test
  void newIdentity_isUnresolvedAndPublic() {
    ProcessLocalIdentity identity = new ProcessLocalIdentity();

    assertThat(identity.state()).isEqualTo(IdentityState.UNRESOLVED);
    assertThat(identity.isAuthenticated()).isFalse();
    assertThat(identity.role()).isEqualTo(Role.PUBLIC);
  }

  @Test
  void beginResolving_firstPass_isResolving() {
    ProcessLocalIdentity identity = new ProcessLocalIdentity();

    ProcessLocalIdentity.Snapshot observed = identity.beginResolving();

    assertThat(observed.state()).isEqualTo(IdentityState.RESOLVING);
    assertThat(identity.state()).isEqualTo(IdentityState.RESOLVING);
    assertThat(identity.role()).isEqualTo(Role.PUBLIC);
  }

  @Test
  void beginResolving_keepsPublishedStateVisible() {
    ProcessLocalIdentity identity = new ProcessLocalIdentity();
    identity.authenticate("sid", BOB);

    identity.beginResolving();

    assertThat(identity.state()).isEqualTo(IdentityState.AUTHENTICATED);
    assertThat(identity.sessionId()).contains("sid");
    assertThat(identity.role()).isEqualTo(Role.ADMIN);
  }

  @Test
  void publish_afterNewerWrite_isRejected() {
    ProcessLocalIdentity identity = new ProcessLocalIdentity();
    ProcessLocalIdentity.Snapshot observed = identity.beginResolving();
    identity.authenticate("fresh", BOB);

    boolean published = identity.publish(observed, ProcessLocalIdentity.Snapshot.ANONYMOUS);

    assertThat(published).isFalse();
    assertThat(identity.sessionId()).contains("fresh");
  }

  @Test
  void publish_fromObservedSnapshot_replacesIt() {
    ProcessLocalIdentity identity = new ProcessLocalIdentity();
    ProcessLocalIdentity.Snapshot observed = identity.beginResolving();

    boolean published = identity.publish(observed, ProcessLocalIdentity.Snapshot.authenticated("sid", BOB));

    assertThat(published).isTrue();
    assertThat(identity.isAuthenticated()).isTrue();
    assertThat(identity.profile()).contains(BOB);
  }

  @Test
  void authenticatedSnapshot_requiresProfile() {
    assertThatThrownBy(() -> ProcessLocalIdentity.Snapshot.authenticated("sid", null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void demote_forgetsEverything() {
    ProcessLocalIdentity identity = new ProcessLocalIdentity();
    identity.authenticate("sid", BOB);

    identity.demote();

    assertThat(identity.state()).isEqualTo(IdentityState.ANONYMOUS);
    assertThat(identity.sessionId()).isEmpty();
    assertThat(identity.profile()).isEmpty();
  }
}
