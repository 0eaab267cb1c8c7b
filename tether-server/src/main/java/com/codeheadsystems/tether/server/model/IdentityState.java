package com.codeheadsystems.tether.server.model;

/**
 * Lifecycle of a {@link ProcessLocalIdentity}.
 */
public enum IdentityState {
  UNRESOLVED,
  RESOLVING,
  AUTHENTICATED,
  ANONYMOUS
}
