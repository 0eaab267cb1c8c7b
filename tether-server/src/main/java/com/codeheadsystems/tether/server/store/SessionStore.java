package com.codeheadsystems.tether.server.store;

import com.codeheadsystems.tether.server.model.SessionRecord;
import com.codeheadsystems.tether.server.model.UserProfile;
import java.util.Optional;

/**
 * Storage abstraction for authenticated sessions shared by every front-end process.
 * <p>
 * Implementations must be thread-safe, and each operation must be atomic on its own: no caller
 * holds a lock across operations. A session is valid only while its expiry lies strictly in the
 * future; expired sessions are never returned.
 */
public interface SessionStore {

  /**
   * Mints a new session for the given user.
   *
   * @param username the account name
   * @param profile  identity snapshot copied into the session
   * @return the stored session, carrying its newly generated id
   * @throws StoreUnavailableException if the datastore cannot be written
   */
  SessionRecord create(String username, UserProfile profile);

  /**
   * Loads a valid session. An expired session found here is deleted and reported as absent;
   * calling again keeps returning empty.
   *
   * @param sessionId opaque token
   * @return the session, or empty if unknown or expired
   * @throws StoreUnavailableException if the datastore cannot be read
   */
  Optional<SessionRecord> get(String sessionId);

  /**
   * Records activity on a session. Best effort: failures are logged, never thrown.
   *
   * @param sessionId opaque token
   */
  void touch(String sessionId);

  /**
   * Deletes one session. Deleting an unknown session is not an error.
   *
   * @param sessionId opaque token
   * @throws StoreUnavailableException if the datastore cannot be written
   */
  void delete(String sessionId);

  /**
   * Deletes every session of the user, wherever it was issued.
   *
   * @param username the account name
   * @return the number of sessions removed
   * @throws StoreUnavailableException if the datastore cannot be written
   */
  int deleteByUsername(String username);

  /**
   * Bulk-deletes expired sessions. Safe to run from several processes at once.
   *
   * @return the number of sessions removed
   * @throws StoreUnavailableException if the datastore cannot be written
   */
  int sweepExpired();

  /**
   * Counts sessions that are still valid.
   *
   * @return the number of valid sessions
   * @throws StoreUnavailableException if the datastore cannot be read
   */
  long countActive();
}
