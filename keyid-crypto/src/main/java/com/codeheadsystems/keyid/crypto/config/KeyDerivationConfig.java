package com.codeheadsystems.keyid.crypto.config;

/**
 * Cost parameters for the passphrase key derivation.
 * <p>
 * Argon2id memory is expressed in kibibytes. The optional salt key turns the BLAKE2b email hash
 * into a keyed hash; leave it empty for the plain hash. Changing any value here changes every
 * derived key, so a deployment must keep them fixed once identities are registered.
 *
 * @param argon2Memory      Argon2id memory cost in KiB
 * @param argon2Iterations  Argon2id time cost
 * @param argon2Parallelism Argon2id lanes
 * @param saltKey           BLAKE2b key for the email salt, empty for none
 */
public record KeyDerivationConfig(
    int argon2Memory,
    int argon2Iterations,
    int argon2Parallelism,
    byte[] saltKey
) {

  /**
   * Argon2id output length, which is also the Ed25519 seed length.
   */
  public static final int SEED_BYTES = 32;

  /**
   * Salt length produced by the BLAKE2b email hash.
   */
  public static final int SALT_BYTES = 16;

  /**
   * Default production configuration: 64 MiB, 3 iterations, 1 lane, unkeyed salt.
   */
  public static final KeyDerivationConfig DEFAULT = new KeyDerivationConfig(65536, 3, 1, new byte[0]);

  public KeyDerivationConfig {
    if (argon2Parallelism < 1) {
      throw new IllegalArgumentException("argon2Parallelism must be at least 1");
    }
    if (argon2Iterations < 1) {
      throw new IllegalArgumentException("argon2Iterations must be at least 1");
    }
    if (argon2Memory < 8 * argon2Parallelism) {
      throw new IllegalArgumentException(
          "argon2Memory must be at least 8 KiB per lane, got " + argon2Memory + " KiB");
    }
    if (saltKey == null) {
      saltKey = new byte[0];
    }
    if (saltKey.length > 64) {
      throw new IllegalArgumentException("saltKey must be at most 64 bytes");
    }
  }

  /**
   * Creates a cheap configuration for tests. Never use outside tests.
   */
  public static KeyDerivationConfig forTesting() {
    return new KeyDerivationConfig(1024, 1, 1, new byte[0]);
  }

  /**
   * Creates an unkeyed configuration with the given Argon2id costs.
   */
  public static KeyDerivationConfig withArgon2id(int memory, int iterations, int parallelism) {
    return new KeyDerivationConfig(memory, iterations, parallelism, new byte[0]);
  }

  /**
   * Returns a new config identical to this one but keying the email salt with {@code key}.
   */
  public KeyDerivationConfig withSaltKey(byte[] key) {
    return new KeyDerivationConfig(argon2Memory, argon2Iterations, argon2Parallelism, key);
  }
}
