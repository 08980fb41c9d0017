package com.codeheadsystems.keyid.server.store;

import com.codeheadsystems.keyid.server.model.SessionData;
import java.util.Optional;

/**
 * Storage abstraction for login sessions.
 * <p>
 * Implementations must be thread-safe.
 * <p>
 * <strong>Device trust contract:</strong> trusting a device invalidates every other session of
 * the account, so implementations must maintain whatever index is necessary to support
 * {@link #revokeAllForUser(String, String)} efficiently; a full-store scan on every trust
 * operation is not acceptable under load.
 */
public interface SessionStore {

  /**
   * Stores session data keyed by session id.
   *
   * @param sessionId   unique session identifier
   * @param sessionData session data to store
   */
  void store(String sessionId, SessionData sessionData);

  /**
   * Loads session data, returning empty if not found or expired.
   *
   * @param sessionId unique session identifier
   * @return the session data, or empty if not found or expired
   */
  Optional<SessionData> load(String sessionId);

  /**
   * Revokes a single session.
   *
   * @param sessionId unique session identifier
   */
  void revoke(String sessionId);

  /**
   * Revokes every session of the account except {@code exceptSessionId}.
   * <p>
   * A null {@code exceptSessionId} revokes all of them. Implementations must handle an account
   * without sessions without throwing.
   *
   * @param userId          the account whose sessions are revoked
   * @param exceptSessionId the caller's own session to keep, or null
   * @return the number of revoked sessions
   */
  int revokeAllForUser(String userId, String exceptSessionId);
}
