package com.codeheadsystems.keyid.server.model;

/**
 * Result of issuing a device token. The raw token is returned exactly once and must only travel
 * in the trust cookie.
 *
 * @param rawToken the secret cookie value
 * @param token    the persisted record (hash only)
 */
public record IssuedDeviceToken(String rawToken, DeviceToken token) {

  @Override
  public String toString() {
    return "IssuedDeviceToken[rawToken=***, token=" + token + "]";
  }
}
