package com.codeheadsystems.tether.server.store;

import com.codeheadsystems.tether.server.model.Role;
import com.codeheadsystems.tether.server.model.SubscriptionStatus;
import com.codeheadsystems.tether.server.model.SubscriptionTier;
import com.codeheadsystems.tether.server.model.UserCredential;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialStore} backed by a YAML file shared by every front-end process.
 * <p>
 * Layout:
 * <pre>
 * credentials:
 *   usernames:
 *     alice:
 *       name: Alice
 *       email: alice@example.com
 *       password: $argon2id$v=19$...
 *       role: subscriber
 *       subscription_tier: pro
 *       subscription_status: active
 *       created_at: 2024-01-01T00:00:00Z
 * </pre>
 * The file is read wholesale and re-read whenever its modification time changes. Mutations take
 * an advisory lock on a {@code <file>.lock} sidecar, re-read the file under that lock, and
 * replace it atomically. Keys this class does not know about are carried through rewrites.
 */
public class YamlCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(YamlCredentialStore.class);

  // FileChannel locks are per process; threads and store instances within one JVM meet here.
  private static final Map<Path, Object> JVM_LOCKS = new ConcurrentHashMap<>();

  static final String CREDENTIALS = "credentials";
  static final String USERNAMES = "usernames";
  static final String NAME = "name";
  static final String EMAIL = "email";
  static final String PASSWORD = "password";
  static final String ROLE = "role";
  static final String TIER = "subscription_tier";
  static final String STATUS = "subscription_status";
  static final String CREATED_AT = "created_at";

  private final Path file;
  private final Path lockFile;
  private final Object jvmLock;
  private final ObjectMapper mapper;

  private ObjectNode root;
  private FileTime loadedModifiedTime;
  private boolean warnedMissing;

  /**
   * Opens the registry. A missing file is an empty registry; it is created on the first write.
   *
   * @param file path to the credential YAML file
   * @throws StoreUnavailableException if the file exists but cannot be read or parsed
   */
  public YamlCredentialStore(Path file) {
    this.file = file.toAbsolutePath().normalize();
    this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
    this.jvmLock = JVM_LOCKS.computeIfAbsent(this.file, k -> new Object());
    this.mapper = new ObjectMapper(new YAMLFactory()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));
    synchronized (this) {
      reload();
    }
    log.info("Credential registry at {} holds {} user(s)", this.file, usernames(root).size());
  }

  @Override
  public synchronized Optional<UserCredential> findByUsername(String username) {
    if (username == null) {
      return Optional.empty();
    }
    refreshIfChanged();
    JsonNode entry = usernames(root).get(username);
    return entry != null && entry.isObject()
        ? Optional.of(toCredential(username, entry))
        : Optional.empty();
  }

  @Override
  public synchronized boolean emailExists(String email) {
    if (email == null) {
      return false;
    }
    refreshIfChanged();
    return emailExistsIn(root, email);
  }

  @Override
  public InsertOutcome insert(UserCredential credential) {
    return mutate(candidate -> {
      ObjectNode users = usernames(candidate);
      if (users.has(credential.username())) {
        return InsertOutcome.USERNAME_EXISTS;
      }
      if (emailExistsIn(candidate, credential.email())) {
        return InsertOutcome.EMAIL_EXISTS;
      }
      users.set(credential.username(), toNode(credential));
      return InsertOutcome.INSERTED;
    }, outcome -> outcome == InsertOutcome.INSERTED);
  }

  @Override
  public boolean updatePasswordHash(String username, String newHash) {
    return mutate(candidate -> {
      JsonNode entry = usernames(candidate).get(username);
      if (entry == null || !entry.isObject()) {
        return false;
      }
      ((ObjectNode) entry).put(PASSWORD, newHash);
      return true;
    }, Boolean::booleanValue);
  }

  /**
   * Runs a change against a freshly read copy of the file while holding the write lock.
   * The file is only rewritten when {@code shouldWrite} accepts the change's result; if the
   * rewrite fails the in-memory view is left as it was before the change.
   */
  private <T> T mutate(Mutation<T> change, Predicate<T> shouldWrite) {
    synchronized (jvmLock) {
      synchronized (this) {
        try {
          Files.createDirectories(file.getParent());
        } catch (IOException e) {
          throw new StoreUnavailableException("Cannot create directory for " + file, e);
        }
        try (FileChannel channel = FileChannel.open(lockFile,
            StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
          reload();
          ObjectNode candidate = root.deepCopy();
          T result = change.apply(candidate);
          if (shouldWrite.test(result)) {
            write(candidate);
            root = candidate;
            loadedModifiedTime = modifiedTime();
          }
          return result;
        } catch (IOException e) {
          throw new StoreUnavailableException("Cannot update credential file " + file, e);
        }
      }
    }
  }

  private void write(ObjectNode content) throws IOException {
    Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
    try {
      mapper.writeValue(temp.toFile(), content);
      try {
        Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private void refreshIfChanged() {
    FileTime current = modifiedTime();
    if (current == null ? loadedModifiedTime != null : !current.equals(loadedModifiedTime)) {
      log.debug("Credential file {} changed, reloading", file);
      reload();
    }
  }

  private void reload() {
    FileTime modified = modifiedTime();
    if (modified == null) {
      if (!warnedMissing) {
        log.warn("Credential file {} does not exist; starting with an empty registry", file);
        warnedMissing = true;
      }
      root = JsonNodeFactory.instance.objectNode();
      loadedModifiedTime = null;
      return;
    }
    try {
      JsonNode parsed = mapper.readTree(file.toFile());
      if (parsed == null || parsed.isMissingNode() || parsed.isNull()) {
        root = JsonNodeFactory.instance.objectNode();
      } else if (parsed.isObject()) {
        root = (ObjectNode) parsed;
      } else {
        throw new StoreUnavailableException("Credential file " + file + " is not a mapping");
      }
      loadedModifiedTime = modified;
    } catch (IOException e) {
      throw new StoreUnavailableException("Cannot read credential file " + file, e);
    }
  }

  private FileTime modifiedTime() {
    try {
      return Files.getLastModifiedTime(file);
    } catch (NoSuchFileException e) {
      return null;
    } catch (IOException e) {
      throw new StoreUnavailableException("Cannot stat credential file " + file, e);
    }
  }

  private static ObjectNode usernames(ObjectNode root) {
    return child(child(root, CREDENTIALS), USERNAMES);
  }

  private static ObjectNode child(ObjectNode parent, String name) {
    JsonNode node = parent.get(name);
    if (node instanceof ObjectNode objectNode) {
      return objectNode;
    }
    return parent.putObject(name);
  }

  private static boolean emailExistsIn(ObjectNode root, String email) {
    if (email == null || email.isBlank()) {
      return false;
    }
    String normalized = email.trim().toLowerCase(Locale.ROOT);
    Iterator<JsonNode> entries = usernames(root).elements();
    while (entries.hasNext()) {
      String existing = entries.next().path(EMAIL).asText("");
      if (existing.trim().toLowerCase(Locale.ROOT).equals(normalized)) {
        return true;
      }
    }
    return false;
  }

  private static UserCredential toCredential(String username, JsonNode entry) {
    String roleName = entry.path(ROLE).asText("user");
    Role role = Role.fromName(roleName).orElseGet(() -> {
      log.warn("Unknown role '{}' for user {}; treating as public", roleName, username);
      return Role.PUBLIC;
    });
    return new UserCredential(
        username,
        entry.path(NAME).asText(username),
        entry.path(EMAIL).asText(""),
        entry.path(PASSWORD).asText(""),
        role,
        SubscriptionTier.fromName(entry.path(TIER).asText(null)),
        SubscriptionStatus.fromName(entry.path(STATUS).asText(null)),
        parseInstant(entry.path(CREATED_AT).asText(null)));
  }

  private static Instant parseInstant(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      log.debug("Ignoring unparseable created_at '{}'", value);
      return null;
    }
  }

  private static ObjectNode toNode(UserCredential credential) {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put(NAME, credential.displayName());
    node.put(EMAIL, credential.email());
    node.put(PASSWORD, credential.passwordHash());
    node.put(ROLE, credential.role().wireName());
    node.put(TIER, credential.subscriptionTier().wireName());
    node.put(STATUS, credential.subscriptionStatus().wireName());
    if (credential.createdAt() != null) {
      node.put(CREATED_AT, credential.createdAt().toString());
    }
    return node;
  }

  @FunctionalInterface
  private interface Mutation<T> {
    T apply(ObjectNode candidate);
  }
}
