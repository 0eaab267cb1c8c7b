package com.codeheadsystems.tether.server.session;

import com.codeheadsystems.tether.server.model.ProcessLocalIdentity;
import java.time.Duration;
import java.util.Optional;

/**
 * The slice of an inbound page request that identity resolution needs.
 * <p>
 * Framework adapters implement this over their own request and response types; cookie and URL
 * changes are collected here and applied by the adapter when the response is written.
 */
public interface PageRequest {

  /**
   * Request attribute under which adapters publish the current {@link PageRequest}.
   */
  String PROPERTY = PageRequest.class.getName();

  /**
   * The identity this process holds for the calling browser.
   */
  ProcessLocalIdentity identity();

  Optional<String> queryParameter(String name);

  /**
   * Removes a query parameter from the URL the browser will show.
   */
  void stripQueryParameter(String name);

  Optional<String> cookie(String name);

  /**
   * Sets an HttpOnly cookie with path {@code /}.
   */
  void setCookie(String name, String value, Duration maxAge);

  void clearCookie(String name);
}
