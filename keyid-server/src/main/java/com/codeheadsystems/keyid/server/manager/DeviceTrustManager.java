package com.codeheadsystems.keyid.server.manager;

import com.codeheadsystems.keyid.server.cookie.TrustCookie;
import com.codeheadsystems.keyid.server.cookie.TrustCookieJar;
import com.codeheadsystems.keyid.server.event.IdentityEvent.DeviceTrusted;
import com.codeheadsystems.keyid.server.event.IdentityEventSink;
import com.codeheadsystems.keyid.server.model.DeviceToken;
import com.codeheadsystems.keyid.server.model.IssuedDeviceToken;
import com.codeheadsystems.keyid.server.model.KeyIdentity;
import com.codeheadsystems.keyid.server.store.DeviceTokenStore;
import com.codeheadsystems.keyid.server.store.SessionStore;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces the single trusted device policy.
 * <p>
 * An account has at most one trusted device. Trusting a device revokes the account's other
 * sessions and replaces its device token; the previously trusted device stops passing
 * {@link #isTrusted} on its next check. The raw token only ever lives in the cookie; the store
 * keeps its SHA-256 hash.
 * <p>
 * Instances are request-scoped: the {@link TrustCookieJar} belongs to the current request.
 */
public class DeviceTrustManager {

  private static final Logger log = LoggerFactory.getLogger(DeviceTrustManager.class);

  public static final String DEFAULT_COOKIE_NAME = "device_trust_token";
  public static final Duration DEFAULT_LIFETIME = Duration.ofDays(90);

  private final DeviceTokenStore deviceTokenStore;
  private final SessionStore sessionStore;
  private final TrustCookieJar cookieJar;
  private final IdentityEventSink events;
  private final String cookieName;
  private final Duration lifetime;

  public DeviceTrustManager(DeviceTokenStore deviceTokenStore, SessionStore sessionStore,
                            TrustCookieJar cookieJar, IdentityEventSink events) {
    this(deviceTokenStore, sessionStore, cookieJar, events, DEFAULT_COOKIE_NAME, DEFAULT_LIFETIME);
  }

  public DeviceTrustManager(DeviceTokenStore deviceTokenStore, SessionStore sessionStore,
                            TrustCookieJar cookieJar, IdentityEventSink events,
                            String cookieName, Duration lifetime) {
    this.deviceTokenStore = Objects.requireNonNull(deviceTokenStore, "deviceTokenStore");
    this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
    this.cookieJar = Objects.requireNonNull(cookieJar, "cookieJar");
    this.events = Objects.requireNonNull(events, "events");
    this.cookieName = Objects.requireNonNull(cookieName, "cookieName");
    this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
    if (lifetime.isNegative() || lifetime.isZero()) {
      throw new IllegalArgumentException("Device trust lifetime must be positive");
    }
  }

  /**
   * Trusts the current device, revoking every session of the account.
   */
  public TrustCookie trust(KeyIdentity identity, String userAgent, String ip) {
    return trust(identity, null, userAgent, ip);
  }

  /**
   * Trusts the current device for the identity.
   *
   * @param identity         the authenticated identity
   * @param currentSessionId the caller's session to keep, or null to revoke all sessions
   * @param userAgent        User-Agent header, may be null
   * @param ip               client address, may be null
   * @return the cookie written to the jar
   */
  public TrustCookie trust(KeyIdentity identity, String currentSessionId, String userAgent,
                           String ip) {
    Objects.requireNonNull(identity, "identity");
    String userId = identity.getId();

    int revoked = sessionStore.revokeAllForUser(userId, currentSessionId);
    String deviceName = DeviceLabels.describe(userAgent);
    IssuedDeviceToken issued = deviceTokenStore.createForUser(userId, deviceName, ip);

    TrustCookie cookie = new TrustCookie(cookieName, issued.rawToken(), lifetime, true,
        TrustCookie.SAME_SITE_LAX, cookieJar.isSecure());
    cookieJar.write(cookie);
    events.publish(new DeviceTrusted(identity, deviceName, ip));
    log.info("Trusted device '{}' for identity id={} ({} other session(s) revoked)",
        deviceName, userId, revoked);
    return cookie;
  }

  /**
   * Checks whether the request's trust cookie belongs to the identity and is still valid.
   * On success the token's last use is recorded.
   *
   * @param identity the identity to check
   * @param ip       client address, may be null
   * @return true only for a live token owned by the identity
   */
  public boolean isTrusted(KeyIdentity identity, String ip) {
    if (identity == null) {
      return false;
    }
    Optional<String> rawToken = cookieJar.read(cookieName).filter(v -> !v.isEmpty());
    if (rawToken.isEmpty()) {
      return false;
    }
    String tokenHash = DeviceToken.hashToken(rawToken.get());
    try {
      Optional<DeviceToken> token = deviceTokenStore.findValidToken(tokenHash);
      if (token.isEmpty() || !token.get().userId().equals(identity.getId())) {
        return false;
      }
      deviceTokenStore.touchLastUsed(tokenHash, ip);
      return true;
    } catch (RuntimeException e) {
      log.warn("Device token store failed; treating device as untrusted", e);
      return false;
    }
  }

  /**
   * Forgets the identity's trusted device and expires the cookie on this request.
   */
  public void revoke(KeyIdentity identity) {
    Objects.requireNonNull(identity, "identity");
    deviceTokenStore.deleteForUser(identity.getId());
    cookieJar.write(TrustCookie.expired(cookieName, cookieJar.isSecure()));
    log.info("Revoked trusted device for identity id={}", identity.getId());
  }

  public String getCookieName() {
    return cookieName;
  }
}
