package com.codeheadsystems.tether.server.store;

import com.codeheadsystems.tether.server.model.Role;
import com.codeheadsystems.tether.server.model.SessionRecord;
import com.codeheadsystems.tether.server.model.SubscriptionStatus;
import com.codeheadsystems.tether.server.model.SubscriptionTier;
import com.codeheadsystems.tether.server.model.UserProfile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * {@link SessionStore} over an embedded SQLite file that every front-end process opens.
 * <p>
 * Each operation borrows a fresh connection and runs a single statement, so SQLite's own
 * locking is the only coordination between processes. Writers wait up to the busy timeout;
 * beyond that the operation fails with {@link StoreUnavailableException}. Timestamps are epoch
 * milliseconds.
 */
public class SqliteSessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(SqliteSessionStore.class);

  static final String TABLE = "active_sessions";

  private static final String COLUMNS = "session_id, username, user_name, user_email, user_role, "
      + "subscription_tier, subscription_status, created_at, last_accessed, expires_at";

  private final DataSource dataSource;
  private final SessionTokens tokens;
  private final Duration ttl;
  private final Clock clock;

  /**
   * Opens (and if needed creates) the session database.
   *
   * @param databaseFile path of the shared SQLite file
   * @param busyTimeout  how long a statement waits on a locked database
   * @param tokens       session id generator
   * @param ttl          lifetime of new sessions
   * @param clock        time source
   * @throws StoreUnavailableException if the database cannot be opened or initialized
   */
  public SqliteSessionStore(Path databaseFile, Duration busyTimeout, SessionTokens tokens,
                            Duration ttl, Clock clock) {
    this(dataSource(databaseFile, busyTimeout), tokens, ttl, clock);
    log.info("Session store opened at {} (ttl={}, busyTimeout={})", databaseFile, ttl, busyTimeout);
  }

  SqliteSessionStore(DataSource dataSource, SessionTokens tokens, Duration ttl, Clock clock) {
    this.dataSource = dataSource;
    this.tokens = tokens;
    this.ttl = ttl;
    this.clock = clock;
    initializeSchema();
  }

  private static DataSource dataSource(Path databaseFile, Duration busyTimeout) {
    Path absolute = databaseFile.toAbsolutePath();
    try {
      if (absolute.getParent() != null) {
        Files.createDirectories(absolute.getParent());
      }
    } catch (IOException e) {
      throw new StoreUnavailableException("Cannot create directory for " + absolute, e);
    }
    SQLiteConfig config = new SQLiteConfig();
    config.setBusyTimeout((int) busyTimeout.toMillis());
    config.setJournalMode(SQLiteConfig.JournalMode.WAL);
    config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
    SQLiteDataSource dataSource = new SQLiteDataSource(config);
    dataSource.setUrl("jdbc:sqlite:" + absolute);
    return dataSource;
  }

  private void initializeSchema() {
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.execute("""
          CREATE TABLE IF NOT EXISTS active_sessions (
              session_id TEXT PRIMARY KEY,
              username TEXT NOT NULL,
              user_name TEXT,
              user_email TEXT,
              user_role TEXT NOT NULL,
              subscription_tier TEXT,
              subscription_status TEXT,
              created_at INTEGER NOT NULL,
              last_accessed INTEGER NOT NULL,
              expires_at INTEGER NOT NULL
          )
          """);
      stmt.execute("CREATE INDEX IF NOT EXISTS idx_active_sessions_expires ON active_sessions(expires_at)");
      stmt.execute("CREATE INDEX IF NOT EXISTS idx_active_sessions_username ON active_sessions(username)");
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to initialize session schema", e);
    }
  }

  @Override
  public SessionRecord create(String username, UserProfile profile) {
    Instant now = clock.instant();
    SessionRecord record = new SessionRecord(tokens.next(), profile, now, now, now.plus(ttl));
    String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, record.sessionId());
      ps.setString(2, username);
      ps.setString(3, profile.displayName());
      ps.setString(4, profile.email());
      ps.setString(5, profile.role().wireName());
      ps.setString(6, profile.subscriptionTier().wireName());
      ps.setString(7, profile.subscriptionStatus().wireName());
      ps.setLong(8, now.toEpochMilli());
      ps.setLong(9, now.toEpochMilli());
      ps.setLong(10, record.expiresAt().toEpochMilli());
      ps.executeUpdate();
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to create session", e);
    }
    log.debug("Created session {} for {}", SessionTokens.prefix(record.sessionId()), username);
    return record;
  }

  @Override
  public Optional<SessionRecord> get(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      return Optional.empty();
    }
    SessionRecord record;
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE session_id = ?")) {
      ps.setString(1, sessionId);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        record = toRecord(rs);
      }
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to read session", e);
    }
    Instant now = clock.instant();
    if (record.isValidAt(now)) {
      return Optional.of(record);
    }
    deleteIfExpired(sessionId, now);
    return Optional.empty();
  }

  private void deleteIfExpired(String sessionId, Instant now) {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "DELETE FROM " + TABLE + " WHERE session_id = ? AND expires_at <= ?")) {
      ps.setString(1, sessionId);
      ps.setLong(2, now.toEpochMilli());
      if (ps.executeUpdate() > 0) {
        log.debug("Evicted expired session {}", SessionTokens.prefix(sessionId));
      }
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to evict expired session", e);
    }
  }

  @Override
  public void touch(String sessionId) {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "UPDATE " + TABLE + " SET last_accessed = ? WHERE session_id = ?")) {
      ps.setLong(1, clock.millis());
      ps.setString(2, sessionId);
      ps.executeUpdate();
    } catch (SQLException e) {
      log.warn("Failed to touch session {}: {}", SessionTokens.prefix(sessionId), e.getMessage());
    }
  }

  @Override
  public void delete(String sessionId) {
    if (sessionId == null) {
      return;
    }
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "DELETE FROM " + TABLE + " WHERE session_id = ?")) {
      ps.setString(1, sessionId);
      ps.executeUpdate();
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to delete session", e);
    }
    log.debug("Deleted session {}", SessionTokens.prefix(sessionId));
  }

  @Override
  public int deleteByUsername(String username) {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "DELETE FROM " + TABLE + " WHERE username = ?")) {
      ps.setString(1, username);
      int removed = ps.executeUpdate();
      log.debug("Deleted {} session(s) for {}", removed, username);
      return removed;
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to delete sessions for user", e);
    }
  }

  @Override
  public int sweepExpired() {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "DELETE FROM " + TABLE + " WHERE expires_at < ?")) {
      ps.setLong(1, clock.millis());
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to sweep expired sessions", e);
    }
  }

  @Override
  public long countActive() {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "SELECT COUNT(*) FROM " + TABLE + " WHERE expires_at > ?")) {
      ps.setLong(1, clock.millis());
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    } catch (SQLException e) {
      throw new StoreUnavailableException("Failed to count sessions", e);
    }
  }

  private static SessionRecord toRecord(ResultSet rs) throws SQLException {
    String username = rs.getString("username");
    String displayName = rs.getString("user_name");
    UserProfile profile = new UserProfile(
        username,
        displayName == null ? username : displayName,
        rs.getString("user_email"),
        Role.fromName(rs.getString("user_role")).orElse(Role.PUBLIC),
        SubscriptionTier.fromName(rs.getString("subscription_tier")),
        SubscriptionStatus.fromName(rs.getString("subscription_status")));
    return new SessionRecord(
        rs.getString("session_id"),
        profile,
        Instant.ofEpochMilli(rs.getLong("created_at")),
        Instant.ofEpochMilli(rs.getLong("last_accessed")),
        Instant.ofEpochMilli(rs.getLong("expires_at")));
  }
}
