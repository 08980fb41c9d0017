package com.codeheadsystems.keyid.server.model;

import java.util.List;
import java.util.Map;

/**
 * A user record that authenticates with a derived Ed25519 key instead of a password.
 * <p>
 * The record carries exactly one public key and never any private key, passphrase or hash of
 * one. Implementations are owned by the application's user persistence layer.
 */
public interface KeyIdentity {

  /**
   * Stable account identifier assigned by the store.
   */
  String getId();

  /**
   * Normalized (trimmed, lowercase) email.
   */
  String getEmail();

  /**
   * Base64 of the 32 raw Ed25519 public key bytes.
   */
  String getPublicKey();

  void setPublicKey(String publicKey);

  /**
   * Ordered recovery-prompt identifiers used by the client to rebuild the prompt UI.
   */
  List<String> getPromptIds();

  void setPromptIds(List<String> promptIds);

  /**
   * Extra profile fields supplied at registration (display name and similar).
   */
  Map<String, String> getAttributes();
}
