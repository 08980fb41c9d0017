package com.codeheadsystems.keyid.server.auth;

import com.codeheadsystems.keyid.server.model.KeyCredentials;
import com.codeheadsystems.keyid.server.model.KeyIdentity;
import java.util.Optional;

/**
 * Per-request authentication guard.
 * <p>
 * A guard holds the authenticated identity for the lifetime of one request-handling context.
 * It is not thread-safe and must not be shared between requests.
 */
public interface Guard {

  /**
   * Name the guard was configured under, reported in events.
   */
  String name();

  /**
   * @return true once an identity has been authenticated
   */
  boolean check();

  default boolean guest() {
    return !check();
  }

  Optional<KeyIdentity> user();

  default Optional<String> id() {
    return user().map(KeyIdentity::getId);
  }

  /**
   * Checks credentials without changing the guard's state.
   */
  boolean validate(KeyCredentials credentials);

  /**
   * Checks credentials and logs the identity in on success.
   */
  boolean attempt(KeyCredentials credentials);

  void login(KeyIdentity identity);

  void logout();
}
