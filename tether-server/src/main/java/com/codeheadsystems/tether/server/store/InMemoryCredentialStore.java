package com.codeheadsystems.tether.server.store;

import com.codeheadsystems.tether.server.model.UserCredential;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore}.
 * <p>
 * Not shared between processes and lost on restart. Suitable for development and testing only.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final Map<String, UserCredential> credentials = new ConcurrentHashMap<>();

  public InMemoryCredentialStore() {
    log.warn("InMemoryCredentialStore in use: registrations are not shared and are lost on restart");
  }

  @Override
  public Optional<UserCredential> findByUsername(String username) {
    return username == null ? Optional.empty() : Optional.ofNullable(credentials.get(username));
  }

  @Override
  public boolean emailExists(String email) {
    if (email == null) {
      return false;
    }
    String normalized = email.trim().toLowerCase(Locale.ROOT);
    return credentials.values().stream()
        .anyMatch(c -> c.email() != null && c.email().trim().toLowerCase(Locale.ROOT).equals(normalized));
  }

  @Override
  public synchronized InsertOutcome insert(UserCredential credential) {
    if (credentials.containsKey(credential.username())) {
      return InsertOutcome.USERNAME_EXISTS;
    }
    if (emailExists(credential.email())) {
      return InsertOutcome.EMAIL_EXISTS;
    }
    credentials.put(credential.username(), credential);
    log.debug("Inserted credential username={}", credential.username());
    return InsertOutcome.INSERTED;
  }

  @Override
  public synchronized boolean updatePasswordHash(String username, String newHash) {
    UserCredential existing = credentials.get(username);
    if (existing == null) {
      return false;
    }
    credentials.put(username, existing.withPasswordHash(newHash));
    return true;
  }
}
