package com.codeheadsystems.tether.server.store;

import com.codeheadsystems.tether.server.model.UserCredential;
import java.util.Optional;

/**
 * Storage abstraction for registered credentials.
 * <p>
 * Implementations must be thread-safe. Credentials are never deleted through this interface.
 */
public interface CredentialStore {

  /**
   * Looks up a credential by exact username.
   *
   * @param username the account name
   * @return the credential, or empty if no such user is registered
   * @throws StoreUnavailableException if the backing store cannot be read
   */
  Optional<UserCredential> findByUsername(String username);

  /**
   * Case-insensitive check for an email address already in use.
   *
   * @param email address to check
   * @return true if any credential carries this address
   * @throws StoreUnavailableException if the backing store cannot be read
   */
  boolean emailExists(String email);

  /**
   * Inserts a new credential. The username check runs first, then the email check; nothing is
   * written unless both pass.
   *
   * @param credential the credential to add
   * @return the outcome
   * @throws StoreUnavailableException if the write fails; no partial record remains
   */
  InsertOutcome insert(UserCredential credential);

  /**
   * Replaces the stored password hash of an existing user.
   *
   * @param username the account name
   * @param newHash  replacement hash
   * @return false if the user does not exist
   * @throws StoreUnavailableException if the write fails
   */
  boolean updatePasswordHash(String username, String newHash);
}
