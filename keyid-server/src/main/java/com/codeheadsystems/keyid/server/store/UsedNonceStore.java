package com.codeheadsystems.keyid.server.store;

import java.time.Instant;

/**
 * Optional ledger of consumed challenge nonces.
 * <p>
 * Nonce validation is stateless, so without a ledger a captured nonce and signature can be
 * replayed until the nonce expires. When a ledger is configured the key guard records every
 * nonce that authenticated successfully and rejects a second use.
 */
public interface UsedNonceStore {

  /**
   * Atomically records the nonce as used.
   *
   * @param nonce     the nonce string
   * @param expiresAt when the nonce stops validating; the entry may be dropped after this
   * @return true if this call recorded it, false if it was already used
   */
  boolean markUsed(String nonce, Instant expiresAt);
}
