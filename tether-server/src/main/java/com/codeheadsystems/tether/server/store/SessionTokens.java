package com.codeheadsystems.tether.server.store;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates opaque session tokens: 32 random bytes, base64url without padding.
 */
public class SessionTokens {

  static final int TOKEN_BYTES = 32;

  private final SecureRandom random;

  public SessionTokens(SecureRandom random) {
    this.random = random;
  }

  public String next() {
    byte[] bytes = new byte[TOKEN_BYTES];
    random.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  /**
   * Short prefix of a token, safe to log.
   */
  public static String prefix(String sessionId) {
    if (sessionId == null) {
      return "null";
    }
    return sessionId.length() <= 8 ? sessionId : sessionId.substring(0, 8) + "...";
  }
}
