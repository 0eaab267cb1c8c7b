package com.codeheadsystems.tether.dropwizard.auth;

import com.codeheadsystems.tether.server.model.Role;
import com.codeheadsystems.tether.server.model.UserProfile;
import java.security.Principal;

/**
 * Principal representing a user with a valid shared session.
 *
 * @param username    account name
 * @param displayName name shown in greetings
 * @param role        role copied into the session at login
 */
public record TetherPrincipal(String username, String displayName, Role role) implements Principal {

  public static TetherPrincipal from(UserProfile profile) {
    return new TetherPrincipal(profile.username(), profile.displayName(), profile.role());
  }

  @Override
  public String getName() {
    return username;
  }
}
