package com.codeheadsystems.tether.server.auth;

/**
 * Cost parameters for new Argon2id hashes. Existing hashes are always verified with the
 * parameters embedded in them.
 *
 * @param memoryKiB   memory cost in KiB
 * @param iterations  time cost
 * @param parallelism lanes
 */
public record Argon2Settings(int memoryKiB, int iterations, int parallelism) {

  public static final Argon2Settings DEFAULT = new Argon2Settings(65536, 3, 1);

  public Argon2Settings {
    if (memoryKiB < 8 * parallelism || iterations < 1 || parallelism < 1) {
      throw new IllegalArgumentException("Invalid Argon2 parameters: m=" + memoryKiB
          + ", t=" + iterations + ", p=" + parallelism);
    }
  }
}
