package com.codeheadsystems.tether.server.testing;

import com.codeheadsystems.tether.server.model.ProcessLocalIdentity;
import com.codeheadsystems.tether.server.session.PageRequest;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory {@link PageRequest} standing in for one browser talking to one front-end process.
 * <p>
 * Cookies set or cleared are applied to the browser's jar immediately, and the identity is kept
 * across {@link #nextPage()} calls the way an HTTP session would keep it.
 */
public class FakePageRequest implements PageRequest {

  private final ProcessLocalIdentity identity;
  private final Map<String, String> cookieJar;
  private final Map<String, String> query = new HashMap<>();
  private final Set<String> stripped = new HashSet<>();
  private final Map<String, Duration> cookieMaxAges = new HashMap<>();

  public FakePageRequest() {
    this(new ProcessLocalIdentity(), new HashMap<>());
  }

  private FakePageRequest(ProcessLocalIdentity identity, Map<String, String> cookieJar) {
    this.identity = identity;
    this.cookieJar = cookieJar;
  }

  /**
   * A new page load from the same browser to the same process.
   */
  public FakePageRequest nextPage() {
    return new FakePageRequest(identity, cookieJar);
  }

  /**
   * A first page load from the same browser to a different process: fresh identity, same cookies.
   */
  public FakePageRequest otherProcess() {
    return new FakePageRequest(new ProcessLocalIdentity(), cookieJar);
  }

  /**
   * A first page load from a browser with no cookies, as when following a link on another device.
   */
  public static FakePageRequest freshBrowser() {
    return new FakePageRequest();
  }

  public FakePageRequest withQueryParameter(String name, String value) {
    query.put(name, value);
    return this;
  }

  public boolean wasStripped(String name) {
    return stripped.contains(name);
  }

  public Map<String, String> cookieJar() {
    return cookieJar;
  }

  public Optional<Duration> cookieMaxAge(String name) {
    return Optional.ofNullable(cookieMaxAges.get(name));
  }

  @Override
  public ProcessLocalIdentity identity() {
    return identity;
  }

  @Override
  public Optional<String> queryParameter(String name) {
    return Optional.ofNullable(query.get(name));
  }

  @Override
  public void stripQueryParameter(String name) {
    query.remove(name);
    stripped.add(name);
  }

  @Override
  public Optional<String> cookie(String name) {
    return Optional.ofNullable(cookieJar.get(name));
  }

  @Override
  public void setCookie(String name, String value, Duration maxAge) {
    cookieJar.put(name, value);
    cookieMaxAges.put(name, maxAge);
  }

  @Override
  public void clearCookie(String name) {
    cookieJar.remove(name);
    cookieMaxAges.put(name, Duration.ZERO);
  }
}
