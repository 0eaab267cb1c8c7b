package com.codeheadsystems.tether.server.store;

/**
 * Result of {@link CredentialStore#insert}.
 */
public enum InsertOutcome {
  INSERTED,
  USERNAME_EXISTS,
  EMAIL_EXISTS
}
