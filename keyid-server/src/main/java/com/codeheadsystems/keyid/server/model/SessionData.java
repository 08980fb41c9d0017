package com.codeheadsystems.keyid.server.model;

import java.time.Instant;

/**
 * Data stored for an authenticated login session.
 *
 * @param userId    the account the session belongs to
 * @param ip        client address at login, may be null
 * @param issuedAt  when the session was created
 * @param expiresAt when the session expires
 */
public record SessionData(
    String userId,
    String ip,
    Instant issuedAt,
    Instant expiresAt) {
}
