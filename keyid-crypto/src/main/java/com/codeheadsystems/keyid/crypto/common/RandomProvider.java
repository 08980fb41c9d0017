package com.codeheadsystems.keyid.crypto.common;

import java.security.SecureRandom;
import org.bouncycastle.util.encoders.Hex;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for nonce entropy and device trust tokens.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Generates {@code len} random bytes and returns them as lowercase hex ({@code 2 * len} chars).
   *
   * @param len the number of random bytes to generate
   * @return lowercase hex string
   */
  public String randomHex(int len) {
    byte[] bytes = randomBytes(len);
    try {
      return Hex.toHexString(bytes);
    } finally {
      ByteUtils.wipe(bytes);
    }
  }
}
