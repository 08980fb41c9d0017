package com.codeheadsystems.keyid.server.event;

import com.codeheadsystems.keyid.server.model.KeyIdentity;

/**
 * Lifecycle and authentication events published by the identity system.
 * <p>
 * Events never carry passphrases, private keys or raw device tokens.
 */
public interface IdentityEvent {

  /**
   * A new identity was registered.
   *
   * @param identity  the created identity
   * @param publicKey base64 public key stored for it
   */
  record IdentityRegistered(KeyIdentity identity, String publicKey) implements IdentityEvent {
  }

  /**
   * An identity's key was replaced through recovery.
   *
   * @param identity  the recovered identity
   * @param publicKey base64 public key now stored for it
   */
  record IdentityRecovered(KeyIdentity identity, String publicKey) implements IdentityEvent {
  }

  /**
   * A guard is about to check credentials for the email.
   */
  record AuthAttempting(String guard, String email) implements IdentityEvent {
  }

  /**
   * A guard authenticated the identity.
   */
  record AuthSucceeded(String guard, KeyIdentity identity) implements IdentityEvent {
  }

  /**
   * A guard rejected an attempt. Carries no reason, only the email that was tried.
   */
  record AuthFailed(String guard, String email) implements IdentityEvent {
  }

  /**
   * A device was marked as trusted for the identity.
   */
  record DeviceTrusted(KeyIdentity identity, String deviceName, String ip) implements IdentityEvent {
  }
}
