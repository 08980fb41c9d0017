package com.codeheadsystems.keyid.server.model;

import java.util.List;
import java.util.Map;

/**
 * Fields for a new identity handed to {@code IdentityStore#create}.
 *
 * @param email      normalized email
 * @param publicKey  base64 Ed25519 public key
 * @param promptIds  recovery-prompt identifiers, possibly empty
 * @param attributes extra profile fields, possibly empty
 */
public record NewIdentity(String email, String publicKey, List<String> promptIds,
                          Map<String, String> attributes) {

  public NewIdentity {
    promptIds = promptIds == null ? List.of() : List.copyOf(promptIds);
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
