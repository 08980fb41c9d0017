package com.codeheadsystems.keyid.server.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import org.bouncycastle.util.encoders.Hex;

/**
 * A persisted device trust token. Only the SHA-256 hash of the raw token is kept.
 *
 * @param tokenHash  lowercase hex SHA-256 of the raw token
 * @param userId     owning account
 * @param deviceName human-readable device label
 * @param ip         last known client address, may be null
 * @param createdAt  issue time
 * @param lastUsedAt last successful trust check
 * @param expiresAt  end of the trust period
 */
public record DeviceToken(
    String tokenHash,
    String userId,
    String deviceName,
    String ip,
    Instant createdAt,
    Instant lastUsedAt,
    Instant expiresAt) {

  /**
   * Hashes a raw token the same way for issue and lookup.
   *
   * @param rawToken the token value carried by the cookie
   * @return lowercase hex SHA-256
   */
  public static String hashToken(String rawToken) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return Hex.toHexString(digest.digest(rawToken.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Returns a copy marked as used now from the given address. A null address keeps the old one.
   */
  public DeviceToken touched(Instant now, String newIp) {
    return new DeviceToken(tokenHash, userId, deviceName, newIp == null ? ip : newIp,
        createdAt, now, expiresAt);
  }

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }
}
