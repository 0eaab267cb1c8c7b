package com.codeheadsystems.tether.server.session;

import com.codeheadsystems.tether.server.model.ProcessLocalIdentity;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Carries the session token to sibling front ends: in outbound links and in the browser cookie.
 */
public class SessionPropagator {

  public static final String DEFAULT_COOKIE_NAME = "tether_session_id";
  public static final String DEFAULT_LINK_PARAMETER = "sessionId";

  private final String cookieName;
  private final String linkParameter;

  public SessionPropagator(String cookieName, String linkParameter) {
    this.cookieName = cookieName;
    this.linkParameter = linkParameter;
  }

  public SessionPropagator() {
    this(DEFAULT_COOKIE_NAME, DEFAULT_LINK_PARAMETER);
  }

  public String cookieName() {
    return cookieName;
  }

  public String linkParameter() {
    return linkParameter;
  }

  /**
   * Adds the session id to a link for an authenticated identity. Any session id already in the
   * link is replaced and a fragment stays at the end. Links for anyone else come back unchanged.
   *
   * @param url      target URL, absolute or relative
   * @param identity the current identity
   * @return the link to render
   */
  public String embedInLink(String url, ProcessLocalIdentity identity) {
    Optional<String> sessionId = identity.sessionId();
    if (url == null || sessionId.isEmpty()) {
      return url;
    }
    String fragment = "";
    String base = url;
    int hash = base.indexOf('#');
    if (hash >= 0) {
      fragment = base.substring(hash);
      base = base.substring(0, hash);
    }
    String query = "";
    int question = base.indexOf('?');
    if (question >= 0) {
      query = base.substring(question + 1);
      base = base.substring(0, question);
    }
    StringBuilder kept = new StringBuilder();
    for (String pair : query.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      String key = pair.split("=", 2)[0];
      if (key.equals(linkParameter)) {
        continue;
      }
      kept.append(kept.length() == 0 ? "" : "&").append(pair);
    }
    kept.append(kept.length() == 0 ? "" : "&")
        .append(linkParameter).append('=')
        .append(URLEncoder.encode(sessionId.get(), StandardCharsets.UTF_8));
    return base + "?" + kept + fragment;
  }

  public void setCookie(PageRequest request, String sessionId, Duration ttl) {
    request.setCookie(cookieName, sessionId, ttl);
  }

  public void clearCookie(PageRequest request) {
    request.clearCookie(cookieName);
  }
}
