package com.codeheadsystems.keyid.server.store;

import com.codeheadsystems.keyid.server.model.SessionData;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired sessions are lazily evicted on {@link #load}. All sessions are lost on
 * server restart. Suitable for development and integration testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, SessionData> store = new ConcurrentHashMap<>();
  // Reverse index: userId → set of session ids, kept in sync with store.
  private final ConcurrentHashMap<String, Set<String>> userToSessions = new ConcurrentHashMap<>();

  private final Clock clock;

  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  public InMemorySessionStore(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemorySessionStore; sessions will NOT survive restarts.");
  }

  @Override
  public void store(String sessionId, SessionData sessionData) {
    store.put(sessionId, sessionData);
    // atomic with the empty-set prune in revoke
    userToSessions.compute(sessionData.userId(), (k, sessions) -> {
      Set<String> ids = sessions == null ? ConcurrentHashMap.newKeySet() : sessions;
      ids.add(sessionId);
      return ids;
    });
    log.debug("Stored session for user={}", sessionData.userId());
  }

  @Override
  public Optional<SessionData> load(String sessionId) {
    SessionData data = store.get(sessionId);
    if (data == null) {
      return Optional.empty();
    }
    if (data.expiresAt().isBefore(clock.instant())) {
      revoke(sessionId);
      return Optional.empty();
    }
    return Optional.of(data);
  }

  @Override
  public void revoke(String sessionId) {
    SessionData data = store.remove(sessionId);
    if (data != null) {
      userToSessions.computeIfPresent(data.userId(), (k, sessions) -> {
        sessions.remove(sessionId);
        return sessions.isEmpty() ? null : sessions;
      });
    }
  }

  @Override
  public int revokeAllForUser(String userId, String exceptSessionId) {
    Set<String> sessions = userToSessions.get(userId);
    if (sessions == null) {
      return 0;
    }
    int revoked = 0;
    for (String sessionId : Set.copyOf(sessions)) {
      if (!sessionId.equals(exceptSessionId)) {
        sessions.remove(sessionId);
        if (store.remove(sessionId) != null) {
          revoked++;
        }
      }
    }
    userToSessions.computeIfPresent(userId, (k, remaining) -> remaining.isEmpty() ? null : remaining);
    log.debug("Revoked {} session(s) for user={}", revoked, userId);
    return revoked;
  }

  /**
   * Number of users with at least one indexed session.
   */
  int indexedUserCount() {
    return userToSessions.size();
  }
}
