package com.codeheadsystems.tether.server.store;

/**
 * Thrown when the credential file or the shared session datastore cannot be read or written.
 * <p>
 * Callers must not treat this as "anonymous" or "authenticated"; it propagates so the request
 * fails closed.
 */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
