package com.codeheadsystems.keyid.server.store;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link UsedNonceStore}. Entries are evicted once their nonce has expired, since an
 * expired nonce fails validation anyway. Only protects a single server instance.
 */
public class InMemoryUsedNonceStore implements UsedNonceStore {

  private final ConcurrentHashMap<String, Instant> used = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryUsedNonceStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public boolean markUsed(String nonce, Instant expiresAt) {
    Instant now = clock.instant();
    used.values().removeIf(expiry -> expiry.isBefore(now));
    return used.putIfAbsent(nonce, expiresAt) == null;
  }

  int size() {
    return used.size();
  }
}
