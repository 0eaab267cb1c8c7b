package com.codeheadsystems.tether.server.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hashes and verifies passwords.
 * <p>
 * New hashes are Argon2id in PHC string form:
 * {@code $argon2id$v=19$m=<KiB>,t=<iterations>,p=<parallelism>$<salt>$<hash>}, with unpadded
 * standard base64 for salt and hash. Stored bcrypt strings and legacy plain-text values are still
 * accepted, but a match on either reports {@link Verification#MATCH_NEEDS_REHASH}.
 */
public class PasswordVerifier {

  private static final Logger log = LoggerFactory.getLogger(PasswordVerifier.class);

  static final int SALT_LENGTH = 16;
  static final int HASH_LENGTH = 32;

  private static final Base64.Encoder B64_ENCODER = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64_DECODER = Base64.getDecoder();

  private final Argon2Settings settings;
  private final SecureRandom random;
  private final String dummyHash;

  public PasswordVerifier(Argon2Settings settings, SecureRandom random) {
    this.settings = settings;
    this.random = random;
    this.dummyHash = hash("tether-timing-equalizer");
  }

  /**
   * Outcome of {@link #verify}.
   */
  public enum Verification {
    MATCH,
    MATCH_NEEDS_REHASH,
    MISMATCH;

    public boolean matched() {
      return this != MISMATCH;
    }
  }

  /**
   * Hashes a password with Argon2id, a fresh random salt and the configured cost.
   *
   * @param plaintext the password
   * @return PHC-formatted hash string
   */
  public String hash(String plaintext) {
    byte[] salt = new byte[SALT_LENGTH];
    random.nextBytes(salt);
    byte[] hash = argon2(Argon2Parameters.ARGON2_id, Argon2Parameters.ARGON2_VERSION_13,
        settings.memoryKiB(), settings.iterations(), settings.parallelism(), salt,
        plaintext, HASH_LENGTH);
    return "$argon2id$v=" + Argon2Parameters.ARGON2_VERSION_13
        + "$m=" + settings.memoryKiB() + ",t=" + settings.iterations() + ",p=" + settings.parallelism()
        + "$" + B64_ENCODER.encodeToString(salt)
        + "$" + B64_ENCODER.encodeToString(hash);
  }

  /**
   * Checks a submitted password against a stored value.
   *
   * @param plaintext the submitted password
   * @param stored    Argon2 PHC string, bcrypt string, or legacy plain text
   * @return the verification outcome
   */
  public Verification verify(String plaintext, String stored) {
    if (plaintext == null || stored == null || stored.isEmpty()) {
      return Verification.MISMATCH;
    }
    if (stored.startsWith("$argon2")) {
      return verifyArgon2(plaintext, stored) ? Verification.MATCH : Verification.MISMATCH;
    }
    if (stored.startsWith("$2a$") || stored.startsWith("$2b$") || stored.startsWith("$2y$")) {
      return verifyBcrypt(plaintext, stored) ? Verification.MATCH_NEEDS_REHASH : Verification.MISMATCH;
    }
    log.warn("Verifying a plain-text stored password; this credential must be re-hashed");
    boolean equal = MessageDigest.isEqual(
        plaintext.getBytes(StandardCharsets.UTF_8), stored.getBytes(StandardCharsets.UTF_8));
    return equal ? Verification.MATCH_NEEDS_REHASH : Verification.MISMATCH;
  }

  /**
   * Spends the cost of one Argon2 verification without checking anything, so that a login for
   * an unknown username takes as long as a login with a wrong password.
   *
   * @param plaintext the submitted password
   */
  public void burn(String plaintext) {
    verifyArgon2(plaintext == null ? "" : plaintext, dummyHash);
  }

  private boolean verifyArgon2(String plaintext, String stored) {
    // "", type, [v=N,] params, salt, hash
    String[] parts = stored.split("\\$");
    try {
      int offset = parts.length == 6 ? 1 : 0;
      if (parts.length != 5 && parts.length != 6) {
        throw new IllegalArgumentException("expected 5 or 6 '$' sections, got " + parts.length);
      }
      int type = argon2Type(parts[1]);
      int version = offset == 1 ? Integer.parseInt(parts[2].substring("v=".length()))
          : Argon2Parameters.ARGON2_VERSION_10;
      int memory = 0;
      int iterations = 0;
      int parallelism = 0;
      for (String param : parts[2 + offset].split(",")) {
        String[] kv = param.split("=", 2);
        int value = Integer.parseInt(kv[1]);
        switch (kv[0]) {
          case "m" -> memory = value;
          case "t" -> iterations = value;
          case "p" -> parallelism = value;
          default -> throw new IllegalArgumentException("unknown parameter " + kv[0]);
        }
      }
      byte[] salt = B64_DECODER.decode(parts[3 + offset]);
      byte[] expected = B64_DECODER.decode(parts[4 + offset]);
      byte[] actual = argon2(type, version, memory, iterations, parallelism, salt, plaintext,
          expected.length);
      return MessageDigest.isEqual(expected, actual);
    } catch (RuntimeException e) {
      log.warn("Malformed Argon2 hash string: {}", e.getMessage());
      return false;
    }
  }

  private static boolean verifyBcrypt(String plaintext, String stored) {
    try {
      return OpenBSDBCrypt.checkPassword(stored, plaintext.toCharArray());
    } catch (RuntimeException e) {
      log.warn("Malformed bcrypt hash string: {}", e.getMessage());
      return false;
    }
  }

  private static int argon2Type(String name) {
    return switch (name) {
      case "argon2id" -> Argon2Parameters.ARGON2_id;
      case "argon2i" -> Argon2Parameters.ARGON2_i;
      case "argon2d" -> Argon2Parameters.ARGON2_d;
      default -> throw new IllegalArgumentException("unknown Argon2 variant " + name);
    };
  }

  private static byte[] argon2(int type, int version, int memory, int iterations, int parallelism,
                               byte[] salt, String plaintext, int length) {
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    gen.init(new Argon2Parameters.Builder(type)
        .withVersion(version)
        .withSalt(salt)
        .withMemoryAsKB(memory)
        .withIterations(iterations)
        .withParallelism(parallelism)
        .build());
    byte[] output = new byte[length];
    gen.generateBytes(plaintext.getBytes(StandardCharsets.UTF_8), output, 0, output.length);
    return output;
  }
}
