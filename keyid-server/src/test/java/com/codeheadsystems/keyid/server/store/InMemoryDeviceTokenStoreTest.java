package com.codeheadsystems.keyid.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.codeheadsystems.keyid.crypto.common.RandomProvider;
import com.codeheadsystems.keyid.server.MutableClock;
import com.codeheadsystems.keyid.server.model.DeviceToken;
import com.codeheadsystems.keyid.server.model.IssuedDeviceToken;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryDeviceTokenStoreTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
  private static final Duration LIFETIME = Duration.ofDays(90);

  private MutableClock clock;
  private InMemoryDeviceTokenStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    store = new InMemoryDeviceTokenStore(new RandomProvider(), clock, LIFETIME);
  }

  @Test
  void createForUser_returnsRawTokenAndStoresOnlyItsHash() {
    IssuedDeviceToken issued = store.createForUser("user-1", "Chrome 120.0 on Linux", "10.0.0.1");

    assertThat(issued.rawToken()).hasSize(64).matches("[0-9a-f]{64}");
    assertThat(issued.token().tokenHash()).isEqualTo(DeviceToken.hashToken(issued.rawToken()));
    assertThat(issued.token().tokenHash()).isNotEqualTo(issued.rawToken());
    assertThat(issued.token().expiresAt()).isEqualTo(T0.plus(LIFETIME));
    assertThat(store.findValidToken(issued.token().tokenHash())).contains(issued.token());
  }

  @Test
  void createForUser_replacesPreviousToken() {
    IssuedDeviceToken first = store.createForUser("user-1", "D1", null);
    IssuedDeviceToken second = store.createForUser("user-1", "D2", null);

    assertThat(store.findValidToken(first.token().tokenHash())).isEmpty();
    assertThat(store.findValidToken(second.token().tokenHash())).isPresent();
  }

  @Test
  void createForUser_doesNotAffectOtherUsers() {
    IssuedDeviceToken alice = store.createForUser("alice", "D1", null);
    store.createForUser("bob", "D2", null);

    assertThat(store.findValidToken(alice.token().tokenHash())).isPresent();
  }

  @Test
  void findValidToken_expired_returnsEmpty() {
    IssuedDeviceToken issued = store.createForUser("user-1", "D1", null);

    clock.set(T0.plus(LIFETIME));

    assertThat(store.findValidToken(issued.token().tokenHash())).isEmpty();
  }

  @Test
  void touchLastUsed_updatesTimestampAndIp() {
    IssuedDeviceToken issued = store.createForUser("user-1", "D1", "10.0.0.1");
    clock.set(T0.plusSeconds(60));

    store.touchLastUsed(issued.token().tokenHash(), "10.0.0.2");

    DeviceToken touched = store.findValidToken(issued.token().tokenHash()).orElseThrow();
    assertThat(touched.lastUsedAt()).isEqualTo(T0.plusSeconds(60));
    assertThat(touched.ip()).isEqualTo("10.0.0.2");
    assertThat(touched.createdAt()).isEqualTo(T0);
  }

  @Test
  void touchLastUsed_nullIp_keepsStoredIp() {
    IssuedDeviceToken issued = store.createForUser("user-1", "D1", "10.0.0.1");

    store.touchLastUsed(issued.token().tokenHash(), null);

    assertThat(store.findValidToken(issued.token().tokenHash()).orElseThrow().ip()).isEqualTo("10.0.0.1");
  }

  @Test
  void deleteForUser_removesToken() {
    IssuedDeviceToken issued = store.createForUser("user-1", "D1", null);

    store.deleteForUser("user-1");

    assertThat(store.findValidToken(issued.token().tokenHash())).isEmpty();
  }

  @Test
  void deleteForUser_unknownUser_doesNotThrow() {
    assertThatCode(() -> store.deleteForUser("nobody")).doesNotThrowAnyException();
  }

  /**
   * Concurrent issues for one account must leave exactly one valid token.
   */
  @Test
  void createForUser_concurrentIssues_leaveSingleValidToken() throws Exception {
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<IssuedDeviceToken>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        String device = "D" + i;
        futures.add(executor.submit(() -> {
          start.await();
          return store.createForUser("user-1", device, null);
        }));
      }
      start.countDown();
      List<IssuedDeviceToken> issued = new ArrayList<>();
      for (Future<IssuedDeviceToken> future : futures) {
        issued.add(future.get(10, TimeUnit.SECONDS));
      }
      // count only once every replacement has landed
      long valid = issued.stream()
          .filter(token -> store.findValidToken(token.token().tokenHash()).isPresent())
          .count();
      assertThat(valid).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }
}
