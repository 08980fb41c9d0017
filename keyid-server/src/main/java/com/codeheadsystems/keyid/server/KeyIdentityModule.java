package com.codeheadsystems.keyid.server;

import com.codeheadsystems.keyid.crypto.KeyDerivationService;
import com.codeheadsystems.keyid.crypto.NonceService;
import com.codeheadsystems.keyid.crypto.common.ByteUtils;
import com.codeheadsystems.keyid.crypto.common.RandomProvider;
import com.codeheadsystems.keyid.crypto.config.KeyDerivationConfig;
import com.codeheadsystems.keyid.server.auth.Guard;
import com.codeheadsystems.keyid.server.auth.KeyGuard;
import com.codeheadsystems.keyid.server.config.KeyIdentityConfiguration;
import com.codeheadsystems.keyid.server.cookie.TrustCookieJar;
import com.codeheadsystems.keyid.server.event.IdentityEventSink;
import com.codeheadsystems.keyid.server.manager.DeviceTrustManager;
import com.codeheadsystems.keyid.server.manager.IdentityManager;
import com.codeheadsystems.keyid.server.store.DeviceTokenStore;
import com.codeheadsystems.keyid.server.store.IdentityStore;
import com.codeheadsystems.keyid.server.store.InMemoryDeviceTokenStore;
import com.codeheadsystems.keyid.server.store.InMemoryIdentityStore;
import com.codeheadsystems.keyid.server.store.InMemorySessionStore;
import com.codeheadsystems.keyid.server.store.InMemoryUsedNonceStore;
import com.codeheadsystems.keyid.server.store.SessionStore;
import com.codeheadsystems.keyid.server.store.UsedNonceStore;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the key-based identity system from a {@link KeyIdentityConfiguration}.
 * <p>
 * With in-memory stores (dev/test only):
 * <pre>{@code
 *   KeyIdentityModule module = new KeyIdentityModule(configuration);
 * }</pre>
 * <p>
 * Or with the application's persistent stores:
 * <pre>{@code
 *   KeyIdentityModule module = new KeyIdentityModule(configuration, identityStore,
 *       deviceTokenStore, sessionStore, usedNonceStore, eventSink, Clock.systemUTC());
 * }</pre>
 * The services are built once and shared. Guards and device trust managers are per request:
 * call {@link #guard()} and {@link #deviceTrust(TrustCookieJar)} for each one.
 */
public class KeyIdentityModule {

  private static final Logger log = LoggerFactory.getLogger(KeyIdentityModule.class);

  private final KeyIdentityConfiguration configuration;
  private final IdentityStore identityStore;
  private final DeviceTokenStore deviceTokenStore;
  private final SessionStore sessionStore;
  private final UsedNonceStore usedNonceStore;
  private final IdentityEventSink events;
  private final KeyDerivationService keyDerivationService;
  private final NonceService nonceService;
  private final IdentityManager identityManager;

  /**
   * Creates a module backed by in-memory stores that discards events.
   * <p>
   * For dev/test only. Identities, trusted devices and sessions are lost on restart.
   */
  public KeyIdentityModule(KeyIdentityConfiguration configuration) {
    this(configuration, new InMemoryIdentityStore(),
        new InMemoryDeviceTokenStore(new RandomProvider(), Clock.systemUTC(),
            Duration.ofDays(configuration.getDeviceTrustDays())),
        new InMemorySessionStore(), null, IdentityEventSink.discarding(), Clock.systemUTC());
    log.warn("""
        #################################################################
        # WARNING: Using ephemeral in-memory identity, device token and #
        # session stores. All data will be lost on restart.             #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a module backed by the supplied stores.
   *
   * @param configuration    validated configuration
   * @param identityStore    user records
   * @param deviceTokenStore trusted device tokens
   * @param sessionStore     login sessions, revoked when a device is trusted
   * @param usedNonceStore   replay ledger; only used with {@code nonceReplayProtection}, and an
   *                         in-memory one is created when it is enabled and this is null
   * @param events           event sink
   * @param clock            time source for nonces
   */
  public KeyIdentityModule(KeyIdentityConfiguration configuration,
                           IdentityStore identityStore,
                           DeviceTokenStore deviceTokenStore,
                           SessionStore sessionStore,
                           UsedNonceStore usedNonceStore,
                           IdentityEventSink events,
                           Clock clock) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.identityStore = Objects.requireNonNull(identityStore, "identityStore");
    this.deviceTokenStore = Objects.requireNonNull(deviceTokenStore, "deviceTokenStore");
    this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
    this.events = Objects.requireNonNull(events, "events");
    this.usedNonceStore = buildUsedNonceStore(configuration, usedNonceStore, clock);
    this.keyDerivationService = new KeyDerivationService(buildKeyDerivationConfig(configuration));
    this.nonceService = buildNonceService(configuration, clock);
    this.identityManager = new IdentityManager(keyDerivationService, nonceService, identityStore,
        events, configuration.getMinPassphraseLength(), configuration.getMinUniqueChars());
  }

  public KeyDerivationService keyDerivationService() {
    return keyDerivationService;
  }

  public NonceService nonceService() {
    return nonceService;
  }

  public IdentityManager identityManager() {
    return identityManager;
  }

  /**
   * Builds a new guard of the configured driver.
   */
  public Guard guard() {
    return switch (configuration.getGuardDriver()) {
      case KEY -> keyGuard();
    };
  }

  /**
   * Builds a new key guard regardless of the configured driver.
   */
  public KeyGuard keyGuard() {
    return new KeyGuard(configuration.getGuardName(), identityManager, usedNonceStore, events);
  }

  /**
   * Builds a device trust manager bound to one request's cookies.
   */
  public DeviceTrustManager deviceTrust(TrustCookieJar cookieJar) {
    return new DeviceTrustManager(deviceTokenStore, sessionStore, cookieJar, events,
        configuration.getTrustCookieName(), Duration.ofDays(configuration.getDeviceTrustDays()));
  }

  public IdentityStore identityStore() {
    return identityStore;
  }

  public SessionStore sessionStore() {
    return sessionStore;
  }

  private static KeyDerivationConfig buildKeyDerivationConfig(KeyIdentityConfiguration configuration) {
    byte[] saltKey = decodeHex("saltKeyHex", configuration.getSaltKeyHex());
    return new KeyDerivationConfig(
        configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(),
        configuration.getArgon2Parallelism(),
        saltKey);
  }

  private static NonceService buildNonceService(KeyIdentityConfiguration configuration, Clock clock) {
    byte[] secret = decodeHex("nonceSecretHex", configuration.getNonceSecretHex());
    if (secret.length == 0) {
      log.warn("No nonce secret configured; generating randomly. "
          + "Outstanding challenges are invalidated on restart. Do not use in production.");
      secret = new RandomProvider().randomBytes(32);
    }
    try {
      return new NonceService(secret, configuration.getNonceTtlSeconds(),
          configuration.getNonceClockSkewSeconds(), clock, new RandomProvider());
    } finally {
      ByteUtils.wipe(secret);
    }
  }

  private static UsedNonceStore buildUsedNonceStore(KeyIdentityConfiguration configuration,
                                                    UsedNonceStore supplied, Clock clock) {
    if (!configuration.isNonceReplayProtection()) {
      return null;
    }
    if (supplied != null) {
      return supplied;
    }
    log.warn("Nonce replay protection uses an in-memory ledger; it only covers this instance.");
    return new InMemoryUsedNonceStore(clock);
  }

  private static byte[] decodeHex(String field, String value) {
    if (value == null || value.isEmpty()) {
      return new byte[0];
    }
    try {
      return HexFormat.of().parseHex(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(field + " is not valid hex", e);
    }
  }
}
