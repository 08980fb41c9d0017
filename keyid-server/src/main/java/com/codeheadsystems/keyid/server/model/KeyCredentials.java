package com.codeheadsystems.keyid.server.model;

/**
 * Email and passphrase submitted to a guard.
 *
 * @param email      the email as typed
 * @param passphrase the passphrase or joined prompt answers
 */
public record KeyCredentials(String email, String passphrase) {

  @Override
  public String toString() {
    return "KeyCredentials[email=" + email + ", passphrase=***]";
  }
}
