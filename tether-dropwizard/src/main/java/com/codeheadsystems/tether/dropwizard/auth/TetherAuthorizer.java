package com.codeheadsystems.tether.dropwizard.auth;

import com.codeheadsystems.tether.server.manager.EntitlementGate;
import io.dropwizard.auth.Authorizer;
import jakarta.ws.rs.container.ContainerRequestContext;

/**
 * Backs {@code @RolesAllowed} with the ordinal role scale, so {@code @RolesAllowed("subscriber")}
 * admits subscribers and everyone ranked above them.
 */
public class TetherAuthorizer implements Authorizer<TetherPrincipal> {

  private final EntitlementGate entitlementGate;

  public TetherAuthorizer(EntitlementGate entitlementGate) {
    this.entitlementGate = entitlementGate;
  }

  @Override
  public boolean authorize(TetherPrincipal principal, String role, ContainerRequestContext requestContext) {
    return entitlementGate.hasAccess(principal.role(), role);
  }
}
