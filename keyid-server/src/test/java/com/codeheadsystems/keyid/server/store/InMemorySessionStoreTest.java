package com.codeheadsystems.keyid.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.codeheadsystems.keyid.server.model.SessionData;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemorySessionStoreTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
  private static final Instant LATER = NOW.plusSeconds(3600);

  private InMemorySessionStore store;

  @BeforeEach
  void setUp() {
    store = new InMemorySessionStore(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void storeAndLoad_roundTrip() {
    SessionData data = new SessionData("user-1", "10.0.0.1", NOW, LATER);
    store.store("sess-1", data);

    Optional<SessionData> loaded = store.load("sess-1");
    assertThat(loaded).isPresent().contains(data);
  }

  @Test
  void load_notFound_returnsEmpty() {
    assertThat(store.load("nonexistent")).isEmpty();
  }

  @Test
  void load_expired_returnsEmpty() {
    store.store("sess-expired", new SessionData("user-1", null, NOW.minusSeconds(7200), NOW.minusSeconds(1)));

    assertThat(store.load("sess-expired")).isEmpty();
  }

  @Test
  void revoke_removesSession() {
    store.store("sess-revoke", new SessionData("user-1", null, NOW, LATER));

    store.revoke("sess-revoke");
    assertThat(store.load("sess-revoke")).isEmpty();
  }

  /**
   * Revoking a user's sessions keeps the caller's own session and leaves other users intact.
   */
  @Test
  void revokeAllForUser_keepsExceptedSessionAndOtherUsers() {
    store.store("a1", new SessionData("user-a", null, NOW, LATER));
    store.store("a2", new SessionData("user-a", null, NOW, LATER));
    store.store("a3", new SessionData("user-a", null, NOW, LATER));
    store.store("b1", new SessionData("user-b", null, NOW, LATER));

    int revoked = store.revokeAllForUser("user-a", "a2");

    assertThat(revoked).isEqualTo(2);
    assertThat(store.load("a1")).isEmpty();
    assertThat(store.load("a2")).isPresent();
    assertThat(store.load("a3")).isEmpty();
    assertThat(store.load("b1")).isPresent();
  }

  @Test
  void revokeAllForUser_nullException_revokesEverything() {
    store.store("a1", new SessionData("user-a", null, NOW, LATER));
    store.store("a2", new SessionData("user-a", null, NOW, LATER));

    assertThat(store.revokeAllForUser("user-a", null)).isEqualTo(2);
    assertThat(store.load("a1")).isEmpty();
    assertThat(store.load("a2")).isEmpty();
  }

  @Test
  void revokeAllForUser_unknownUser_doesNotThrow() {
    assertThatCode(() -> store.revokeAllForUser("nobody", null)).doesNotThrowAnyException();
    assertThat(store.revokeAllForUser("nobody", null)).isZero();
  }

  @Test
  void revoke_lastSession_dropsUserFromIndex() {
    store.store("a1", new SessionData("user-a", null, NOW, LATER));
    store.store("a2", new SessionData("user-a", null, NOW, LATER));

    store.revoke("a1");
    assertThat(store.indexedUserCount()).isEqualTo(1);

    store.revoke("a2");
    assertThat(store.indexedUserCount()).isZero();
  }

  @Test
  void revokeAllForUser_dropsUserFromIndexUnlessSessionKept() {
    store.store("a1", new SessionData("user-a", null, NOW, LATER));
    store.store("b1", new SessionData("user-b", null, NOW, LATER));
    store.store("b2", new SessionData("user-b", null, NOW, LATER));

    store.revokeAllForUser("user-a", null);
    store.revokeAllForUser("user-b", "b2");

    assertThat(store.indexedUserCount()).isEqualTo(1);
    assertThat(store.revokeAllForUser("user-b", null)).isEqualTo(1);
    assertThat(store.indexedUserCount()).isZero();
  }

  @Test
  void load_expiredSession_dropsUserFromIndex() {
    store.store("sess-expired", new SessionData("user-1", null, NOW.minusSeconds(7200), NOW.minusSeconds(1)));

    assertThat(store.load("sess-expired")).isEmpty();
    assertThat(store.indexedUserCount()).isZero();
  }

  @Test
  void store_afterFullRevoke_isIndexedAgain() {
    store.store("a1", new SessionData("user-a", null, NOW, LATER));
    store.revokeAllForUser("user-a", null);

    store.store("a2", new SessionData("user-a", null, NOW, LATER));

    assertThat(store.revokeAllForUser("user-a", null)).isEqualTo(1);
    assertThat(store.load("a2")).isEmpty();
  }
}
