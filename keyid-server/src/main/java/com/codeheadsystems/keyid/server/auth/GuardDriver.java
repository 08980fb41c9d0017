package com.codeheadsystems.keyid.server.auth;

/**
 * The guard implementations this system can build. Selected by configuration.
 * Session, token and JWT guards live outside the identity system.
 */
public enum GuardDriver {
  /**
   * Ed25519 challenge-response over a derived key, see {@link KeyGuard}.
   */
  KEY
}
