package com.codeheadsystems.keyid.crypto.model;

import com.codeheadsystems.keyid.crypto.common.ByteUtils;

/**
 * An Ed25519 keypair derived from an email and passphrase.
 * <p>
 * Holds the 32-byte seed, the 64-byte expanded private key ({@code seed || publicKey}) and the
 * 32-byte public key. Accessors return the backing arrays rather than copies so that no
 * duplicate of the secret is left on the heap. Always use it in try-with-resources:
 * <pre>{@code
 *   try (DerivedKeyPair keyPair = keyService.deriveKeyPair(email, passphrase)) {
 *     ...
 *   }
 * }</pre>
 * {@link #close()} zeroes the seed and private key. The public key is left intact.
 */
public final class DerivedKeyPair implements AutoCloseable {

  private final byte[] seed;
  private final byte[] privateKey;
  private final byte[] publicKey;
  private volatile boolean destroyed;

  /**
   * Takes ownership of the given arrays.
   *
   * @param seed       32-byte seed
   * @param privateKey 64-byte expanded private key
   * @param publicKey  32-byte public key
   */
  public DerivedKeyPair(byte[] seed, byte[] privateKey, byte[] publicKey) {
    this.seed = seed;
    this.privateKey = privateKey;
    this.publicKey = publicKey;
  }

  public byte[] seed() {
    checkNotDestroyed();
    return seed;
  }

  public byte[] privateKey() {
    checkNotDestroyed();
    return privateKey;
  }

  public byte[] publicKey() {
    return publicKey;
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  @Override
  public void close() {
    ByteUtils.wipe(seed, privateKey);
    destroyed = true;
  }

  private void checkNotDestroyed() {
    if (destroyed) {
      throw new IllegalStateException("Key material has already been wiped");
    }
  }

  @Override
  public String toString() {
    return "DerivedKeyPair[destroyed=" + destroyed + "]";
  }
}
