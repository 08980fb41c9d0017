package com.codeheadsystems.keyid.server.store;

import com.codeheadsystems.keyid.crypto.common.RandomProvider;
import com.codeheadsystems.keyid.server.model.DeviceToken;
import com.codeheadsystems.keyid.server.model.IssuedDeviceToken;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link DeviceTokenStore}.
 * <p>
 * Tokens are keyed by account; a reverse index maps token hashes to accounts. Both maps are
 * updated inside a single {@code compute} on the account key so replacement is atomic per
 * account. Suitable for development and testing only.
 */
public class InMemoryDeviceTokenStore implements DeviceTokenStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDeviceTokenStore.class);

  public static final int RAW_TOKEN_BYTES = 32;

  private final ConcurrentHashMap<String, DeviceToken> byUser = new ConcurrentHashMap<>();
  // Reverse index: tokenHash → userId, kept in sync with byUser.
  private final ConcurrentHashMap<String, String> hashToUser = new ConcurrentHashMap<>();

  private final RandomProvider randomProvider;
  private final Clock clock;
  private final Duration lifetime;

  public InMemoryDeviceTokenStore(RandomProvider randomProvider, Clock clock, Duration lifetime) {
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.lifetime = lifetime;
    log.warn("Using InMemoryDeviceTokenStore; trusted devices will NOT survive restarts.");
  }

  @Override
  public IssuedDeviceToken createForUser(String userId, String deviceName, String ip) {
    String rawToken = randomProvider.randomHex(RAW_TOKEN_BYTES);
    Instant now = clock.instant();
    DeviceToken token = new DeviceToken(DeviceToken.hashToken(rawToken), userId, deviceName, ip,
        now, now, now.plus(lifetime));
    byUser.compute(userId, (id, previous) -> {
      if (previous != null) {
        hashToUser.remove(previous.tokenHash());
      }
      hashToUser.put(token.tokenHash(), id);
      return token;
    });
    log.debug("Issued device token for user={} device='{}'", userId, deviceName);
    return new IssuedDeviceToken(rawToken, token);
  }

  @Override
  public Optional<DeviceToken> findValidToken(String tokenHash) {
    String userId = hashToUser.get(tokenHash);
    if (userId == null) {
      return Optional.empty();
    }
    DeviceToken token = byUser.get(userId);
    if (token == null || !token.tokenHash().equals(tokenHash) || token.isExpired(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(token);
  }

  @Override
  public void touchLastUsed(String tokenHash, String ip) {
    String userId = hashToUser.get(tokenHash);
    if (userId == null) {
      return;
    }
    byUser.computeIfPresent(userId, (id, token) ->
        token.tokenHash().equals(tokenHash) ? token.touched(clock.instant(), ip) : token);
  }

  @Override
  public void deleteForUser(String userId) {
    byUser.computeIfPresent(userId, (id, token) -> {
      hashToUser.remove(token.tokenHash());
      return null;
    });
    log.debug("Deleted device token for user={}", userId);
  }
}
