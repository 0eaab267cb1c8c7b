package com.codeheadsystems.tether.dropwizard.auth;

import com.codeheadsystems.tether.server.model.ProcessLocalIdentity;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Turns an already resolved {@link ProcessLocalIdentity} into a {@link TetherPrincipal}.
 * Resolution itself happens earlier, in the session resolution filter.
 */
public class TetherAuthenticator implements Authenticator<ProcessLocalIdentity, TetherPrincipal> {

  @Override
  public Optional<TetherPrincipal> authenticate(ProcessLocalIdentity identity) {
    if (identity == null) {
      return Optional.empty();
    }
    // profile() is only present on an authenticated snapshot.
    return identity.profile().map(TetherPrincipal::from);
  }
}
