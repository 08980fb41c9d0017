package com.codeheadsystems.keyid.server.cookie;

import java.time.Duration;

/**
 * A cookie to be written by the transport layer.
 *
 * @param name     cookie name
 * @param value    cookie value; empty for an expiring cookie
 * @param maxAge   lifetime; zero expires the cookie
 * @param httpOnly whether scripts are denied access
 * @param sameSite SameSite attribute value
 * @param secure   whether the cookie is limited to encrypted transport
 */
public record TrustCookie(String name, String value, Duration maxAge, boolean httpOnly,
                          String sameSite, boolean secure) {

  public static final String SAME_SITE_LAX = "Lax";

  /**
   * A cookie that tells the client to drop {@code name}.
   */
  public static TrustCookie expired(String name, boolean secure) {
    return new TrustCookie(name, "", Duration.ZERO, true, SAME_SITE_LAX, secure);
  }

  /**
   * Renders the value of a {@code Set-Cookie} header.
   */
  public String toHeaderValue() {
    StringBuilder sb = new StringBuilder()
        .append(name).append('=').append(value)
        .append("; Max-Age=").append(maxAge.getSeconds())
        .append("; Path=/");
    if (secure) {
      sb.append("; Secure");
    }
    if (httpOnly) {
      sb.append("; HttpOnly");
    }
    if (sameSite != null) {
      sb.append("; SameSite=").append(sameSite);
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "TrustCookie[name=" + name + ", value=<redacted>, maxAge=" + maxAge
        + ", httpOnly=" + httpOnly + ", sameSite=" + sameSite + ", secure=" + secure + "]";
  }
}
