package com.codeheadsystems.keyid.server.cookie;

import java.util.Optional;

/**
 * The request/response cookie surface of whatever HTTP layer hosts the identity system.
 * Implementations are request-scoped.
 */
public interface TrustCookieJar {

  /**
   * Reads a cookie sent by the client.
   *
   * @param name cookie name
   * @return the value, or empty when absent
   */
  Optional<String> read(String name);

  /**
   * Queues a cookie on the response.
   */
  void write(TrustCookie cookie);

  /**
   * Whether the current request arrived over an encrypted transport.
   */
  boolean isSecure();
}
