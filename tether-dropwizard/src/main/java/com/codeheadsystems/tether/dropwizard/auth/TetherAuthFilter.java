package com.codeheadsystems.tether.dropwizard.auth;

import com.codeheadsystems.tether.server.model.ProcessLocalIdentity;
import com.codeheadsystems.tether.server.session.PageRequest;
import io.dropwizard.auth.AuthFilter;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;

/**
 * Authentication filter for resources that take an {@code @Auth TetherPrincipal} or carry
 * {@code @RolesAllowed}. Callers without a valid shared session get 401.
 */
@Priority(Priorities.AUTHENTICATION)
public class TetherAuthFilter extends AuthFilter<ProcessLocalIdentity, TetherPrincipal> {

  static final String SCHEME = "SESSION";

  private TetherAuthFilter() {
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    Object property = requestContext.getProperty(PageRequest.PROPERTY);
    ProcessLocalIdentity identity = property instanceof PageRequest pageRequest
        ? pageRequest.identity()
        : null;
    if (!authenticate(requestContext, identity, SCHEME)) {
      throw new WebApplicationException(unauthorizedHandler.buildResponse(prefix, realm));
    }
  }

  /**
   * Builder for {@link TetherAuthFilter}.
   */
  public static class Builder extends AuthFilterBuilder<ProcessLocalIdentity, TetherPrincipal, TetherAuthFilter> {

    @Override
    protected TetherAuthFilter newInstance() {
      return new TetherAuthFilter();
    }
  }
}
