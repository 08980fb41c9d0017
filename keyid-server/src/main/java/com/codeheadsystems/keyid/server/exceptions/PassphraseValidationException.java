package com.codeheadsystems.keyid.server.exceptions;

import java.util.List;

/**
 * Thrown by registration and recovery when a passphrase is below the entropy floor.
 * Carries the individual reasons so the caller can show actionable feedback.
 */
public class PassphraseValidationException extends RuntimeException {

  private final List<String> errors;

  public PassphraseValidationException(List<String> errors) {
    super("Passphrase does not meet entropy requirements: " + String.join(" ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> getErrors() {
    return errors;
  }
}
