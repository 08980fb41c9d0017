package com.codeheadsystems.keyid.crypto.model;

import java.util.List;

/**
 * Outcome of a passphrase entropy check.
 *
 * @param valid  true when no rule was violated
 * @param errors human-readable reasons, empty when valid
 */
public record EntropyResult(boolean valid, List<String> errors) {

  public EntropyResult {
    errors = List.copyOf(errors);
  }

  /**
   * Builds a result from the collected errors.
   */
  public static EntropyResult of(List<String> errors) {
    return new EntropyResult(errors.isEmpty(), errors);
  }
}
