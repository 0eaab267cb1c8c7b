package com.codeheadsystems.tether.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tether.server.manager.EntitlementGate;
import com.codeheadsystems.tether.server.model.ProcessLocalIdentity;
import com.codeheadsystems.tether.server.model.Role;
import com.codeheadsystems.tether.server.model.SubscriptionStatus;
import com.codeheadsystems.tether.server.model.SubscriptionTier;
import com.codeheadsystems.tether.server.model.UserProfile;
import org.junit.jupiter.api.Test;

class TetherAuthorizerTest {

  private final TetherAuthorizer authorizer = new TetherAuthorizer(new EntitlementGate());
  private final TetherAuthenticator authenticator = new TetherAuthenticator();

  @Test
  void authorize_higherRoleSatisfiesLowerRequirement() {
    TetherPrincipal admin = new TetherPrincipal("root", "Root", Role.ADMIN);

    assertThat(authorizer.authorize(admin, "subscriber", null)).isTrue();
    assertThat(authorizer.authorize(admin, "superadmin", null)).isFalse();
    assertThat(authorizer.authorize(admin, "no-such-role", null)).isFalse();
  }

  @Test
  void authenticate_onlyAuthenticatedIdentities() {
    ProcessLocalIdentity identity = new ProcessLocalIdentity();
    assertThat(authenticator.authenticate(identity)).isEmpty();
    assertThat(authenticator.authenticate(null)).isEmpty();

    identity.authenticate("sid", new UserProfile("alice", "Alice", "a@x.com", Role.USER,
        SubscriptionTier.FREE, SubscriptionStatus.INACTIVE));

    assertThat(authenticator.authenticate(identity))
        .contains(new TetherPrincipal("alice", "Alice", Role.USER));
  }
}
