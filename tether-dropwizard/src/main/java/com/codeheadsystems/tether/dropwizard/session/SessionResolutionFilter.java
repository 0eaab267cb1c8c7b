package com.codeheadsystems.tether.dropwizard.session;

import com.codeheadsystems.tether.server.manager.AuthService;
import com.codeheadsystems.tether.server.model.ProcessLocalIdentity;
import com.codeheadsystems.tether.server.session.PageRequest;
import jakarta.annotation.Priority;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import jakarta.ws.rs.HttpMethod;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriBuilder;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the caller's identity at the start of every request, before authentication.
 * <p>
 * The {@link ProcessLocalIdentity} lives in the servlet {@link HttpSession}, which is local to
 * this process. A servlet session is only created once the identity holds a session id worth
 * caching; anonymous callers get a throwaway identity per request. The resolved {@link PageRequest} is published as a request property for
 * {@code AuthResource} and the auth filter. When a session id arrived as a query parameter on a
 * GET, the caller is redirected (303) to the same URL without it. Queued cookie changes are
 * written on the way out.
 */
@Priority(Priorities.AUTHENTICATION - 100)
public class SessionResolutionFilter implements ContainerRequestFilter, ContainerResponseFilter {

  private static final Logger log = LoggerFactory.getLogger(SessionResolutionFilter.class);

  static final String IDENTITY_ATTRIBUTE = ProcessLocalIdentity.class.getName();

  private final AuthService authService;
  private final boolean secureCookies;

  @Context
  private HttpServletRequest servletRequest;

  public SessionResolutionFilter(AuthService authService, boolean secureCookies) {
    this.authService = authService;
    this.secureCookies = secureCookies;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    JaxrsPageRequest pageRequest = new JaxrsPageRequest(requestContext, cachedIdentity(), secureCookies);
    requestContext.setProperty(PageRequest.PROPERTY, pageRequest);
    authService.resolve(pageRequest);
    remember(pageRequest.identity());

    if (!pageRequest.strippedParameters().isEmpty()
        && HttpMethod.GET.equals(requestContext.getMethod())) {
      UriBuilder clean = requestContext.getUriInfo().getRequestUriBuilder();
      for (String name : pageRequest.strippedParameters()) {
        clean.replaceQueryParam(name);
      }
      URI location = clean.build();
      log.debug("Redirecting to {} after consuming link parameter", location.getPath());
      requestContext.abortWith(Response.seeOther(location)
          .cookie(pageRequest.drainCookies().toArray(new NewCookie[0]))
          .build());
    }
  }

  @Override
  public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
    Object property = requestContext.getProperty(PageRequest.PROPERTY);
    if (property instanceof JaxrsPageRequest pageRequest) {
      // A login during this request has to be cached too.
      remember(pageRequest.identity());
      for (NewCookie cookie : pageRequest.drainCookies()) {
        responseContext.getHeaders().add(HttpHeaders.SET_COOKIE, cookie);
      }
    }
  }

  private ProcessLocalIdentity cachedIdentity() {
    HttpSession session = servletRequest.getSession(false);
    if (session != null && session.getAttribute(IDENTITY_ATTRIBUTE) instanceof ProcessLocalIdentity identity) {
      return identity;
    }
    return new ProcessLocalIdentity();
  }

  private void remember(ProcessLocalIdentity identity) {
    if (!identity.isAuthenticated()) {
      return;
    }
    HttpSession session = servletRequest.getSession(true);
    synchronized (session) {
      if (session.getAttribute(IDENTITY_ATTRIBUTE) == null) {
        session.setAttribute(IDENTITY_ATTRIBUTE, identity);
      }
    }
  }
}
