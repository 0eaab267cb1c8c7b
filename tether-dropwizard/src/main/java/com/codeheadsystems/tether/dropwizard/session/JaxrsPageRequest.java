package com.codeheadsystems.tether.dropwizard.session;

import com.codeheadsystems.tether.server.model.ProcessLocalIdentity;
import com.codeheadsystems.tether.server.session.PageRequest;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.NewCookie;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link PageRequest} over a JAX-RS request. Cookie changes are queued and written to the
 * response by {@link SessionResolutionFilter}.
 */
public class JaxrsPageRequest implements PageRequest {

  private final ContainerRequestContext requestContext;
  private final ProcessLocalIdentity identity;
  private final boolean secureCookies;
  private final List<NewCookie> pendingCookies = new ArrayList<>();
  private final Set<String> strippedParameters = new HashSet<>();

  public JaxrsPageRequest(ContainerRequestContext requestContext, ProcessLocalIdentity identity,
                          boolean secureCookies) {
    this.requestContext = requestContext;
    this.identity = identity;
    this.secureCookies = secureCookies;
  }

  @Override
  public ProcessLocalIdentity identity() {
    return identity;
  }

  @Override
  public Optional<String> queryParameter(String name) {
    return Optional.ofNullable(requestContext.getUriInfo().getQueryParameters().getFirst(name));
  }

  @Override
  public void stripQueryParameter(String name) {
    strippedParameters.add(name);
  }

  @Override
  public Optional<String> cookie(String name) {
    Cookie cookie = requestContext.getCookies().get(name);
    return cookie == null ? Optional.empty() : Optional.ofNullable(cookie.getValue());
  }

  @Override
  public void setCookie(String name, String value, Duration maxAge) {
    pendingCookies.add(new NewCookie(name, value, "/", null, null,
        (int) Math.min(Integer.MAX_VALUE, maxAge.getSeconds()), secureCookies, true));
  }

  @Override
  public void clearCookie(String name) {
    pendingCookies.add(new NewCookie(name, "", "/", null, null, 0, secureCookies, true));
  }

  /**
   * Query parameters to remove from the visible URL.
   */
  public Set<String> strippedParameters() {
    return strippedParameters;
  }

  /**
   * Returns and forgets the queued cookie changes.
   */
  public List<NewCookie> drainCookies() {
    List<NewCookie> drained = new ArrayList<>(pendingCookies);
    pendingCookies.clear();
    return drained;
  }
}
