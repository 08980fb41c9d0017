package com.codeheadsystems.keyid.server.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Plain mutable {@link KeyIdentity} used by the in-memory store.
 */
public class IdentityRecord implements KeyIdentity {

  private final String id;
  private final String email;
  private final Map<String, String> attributes;
  private String publicKey;
  private List<String> promptIds;

  public IdentityRecord(String id, String email, String publicKey, List<String> promptIds,
                        Map<String, String> attributes) {
    this.id = Objects.requireNonNull(id, "id");
    this.email = Objects.requireNonNull(email, "email");
    this.publicKey = publicKey;
    this.promptIds = promptIds == null ? List.of() : List.copyOf(promptIds);
    this.attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  /**
   * Copies any identity into a detached record.
   */
  public static IdentityRecord copyOf(KeyIdentity identity) {
    return new IdentityRecord(identity.getId(), identity.getEmail(), identity.getPublicKey(),
        identity.getPromptIds(), identity.getAttributes());
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public String getEmail() {
    return email;
  }

  @Override
  public String getPublicKey() {
    return publicKey;
  }

  @Override
  public void setPublicKey(String publicKey) {
    this.publicKey = publicKey;
  }

  @Override
  public List<String> getPromptIds() {
    return promptIds;
  }

  @Override
  public void setPromptIds(List<String> promptIds) {
    this.promptIds = promptIds == null ? List.of() : List.copyOf(promptIds);
  }

  @Override
  public Map<String, String> getAttributes() {
    return attributes;
  }

  @Override
  public String toString() {
    return "IdentityRecord[id=" + id + ", email=" + email + "]";
  }
}
