package com.codeheadsystems.keyid.server.store;

import com.codeheadsystems.keyid.server.model.DeviceToken;
import com.codeheadsystems.keyid.server.model.IssuedDeviceToken;
import java.util.Optional;

/**
 * Storage abstraction for device trust tokens.
 * <p>
 * <strong>Single-trust contract:</strong> an account holds at most one token.
 * {@link #createForUser} must atomically replace any existing token for the account, so that two
 * concurrent issues for the same account never leave two valid tokens behind.
 */
public interface DeviceTokenStore {

  /**
   * Issues a new random token for the account, replacing any previous one.
   *
   * @param userId     owning account
   * @param deviceName human-readable device label
   * @param ip         client address, may be null
   * @return the raw token (only returned here) and the persisted record
   */
  IssuedDeviceToken createForUser(String userId, String deviceName, String ip);

  /**
   * Finds a non-expired token by the SHA-256 hash of its raw value.
   *
   * @param tokenHash lowercase hex SHA-256 of the raw token
   * @return the token, or empty when unknown or expired
   */
  Optional<DeviceToken> findValidToken(String tokenHash);

  /**
   * Records a successful use. A null address keeps the stored one.
   */
  void touchLastUsed(String tokenHash, String ip);

  /**
   * Removes the account's token, if any. Must not throw when none exists.
   */
  void deleteForUser(String userId);
}
