package com.codeheadsystems.keyid.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.keyid.crypto.common.RandomProvider;
import com.codeheadsystems.keyid.server.MutableClock;
import com.codeheadsystems.keyid.server.cookie.InMemoryTrustCookieJar;
import com.codeheadsystems.keyid.server.cookie.TrustCookie;
import com.codeheadsystems.keyid.server.event.IdentityEvent.DeviceTrusted;
import com.codeheadsystems.keyid.server.event.IdentityEventSink;
import com.codeheadsystems.keyid.server.model.DeviceToken;
import com.codeheadsystems.keyid.server.model.IdentityRecord;
import com.codeheadsystems.keyid.server.model.KeyIdentity;
import com.codeheadsystems.keyid.server.model.SessionData;
import com.codeheadsystems.keyid.server.store.DeviceTokenStore;
import com.codeheadsystems.keyid.server.store.InMemoryDeviceTokenStore;
import com.codeheadsystems.keyid.server.store.InMemorySessionStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DeviceTrustManagerTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
  private static final String CHROME_WINDOWS = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
      + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
  private static final String COOKIE = DeviceTrustManager.DEFAULT_COOKIE_NAME;

  @Mock private IdentityEventSink events;

  private MutableClock clock;
  private InMemoryDeviceTokenStore tokenStore;
  private InMemorySessionStore sessionStore;
  private KeyIdentity alice;
  private KeyIdentity bob;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    tokenStore = new InMemoryDeviceTokenStore(new RandomProvider(), clock, Duration.ofDays(90));
    sessionStore = new InMemorySessionStore(clock);
    alice = new IdentityRecord("id-alice", "alice@example.com", "pk", List.of(), Map.of());
    bob = new IdentityRecord("id-bob", "bob@example.com", "pk", List.of(), Map.of());
  }

  private DeviceTrustManager managerFor(InMemoryTrustCookieJar jar) {
    return new DeviceTrustManager(tokenStore, sessionStore, jar, events);
  }

  @Nested
  class Trust {

    @Test
    void writesHardenedCookie() {
      InMemoryTrustCookieJar jar = new InMemoryTrustCookieJar(true);

      TrustCookie cookie = managerFor(jar).trust(alice, CHROME_WINDOWS, "10.0.0.1");

      assertThat(jar.written()).containsExactly(cookie);
      assertThat(cookie.name()).isEqualTo("device_trust_token");
      assertThat(cookie.value()).matches("[0-9a-f]{64}");
      assertThat(cookie.maxAge()).isEqualTo(Duration.ofDays(90));
      assertThat(cookie.httpOnly()).isTrue();
      assertThat(cookie.sameSite()).isEqualTo("Lax");
      assertThat(cookie.secure()).isTrue();
    }

    @Test
    void plainTransport_cookieNotSecure() {
      TrustCookie cookie = managerFor(new InMemoryTrustCookieJar(false)).trust(alice, null, null);

      assertThat(cookie.secure()).isFalse();
    }

    @Test
    void storesHashedTokenWithDeviceLabel() {
      TrustCookie cookie = managerFor(new InMemoryTrustCookieJar()).trust(alice, CHROME_WINDOWS, "10.0.0.1");

      DeviceToken token = tokenStore.findValidToken(DeviceToken.hashToken(cookie.value())).orElseThrow();
      assertThat(token.userId()).isEqualTo("id-alice");
      assertThat(token.deviceName()).isEqualTo("Chrome 120.0.0.0 on Windows 10/11");
      assertThat(token.ip()).isEqualTo("10.0.0.1");
    }

    @Test
    void revokesOtherSessionsButKeepsCurrent() {
      sessionStore.store("current", new SessionData("id-alice", null, T0, T0.plusSeconds(3600)));
      sessionStore.store("other", new SessionData("id-alice", null, T0, T0.plusSeconds(3600)));
      sessionStore.store("bob", new SessionData("id-bob", null, T0, T0.plusSeconds(3600)));

      managerFor(new InMemoryTrustCookieJar()).trust(alice, "current", CHROME_WINDOWS, null);

      assertThat(sessionStore.load("current")).isPresent();
      assertThat(sessionStore.load("other")).isEmpty();
      assertThat(sessionStore.load("bob")).isPresent();
    }

    @Test
    void publishesDeviceTrustedEvent() {
      managerFor(new InMemoryTrustCookieJar()).trust(alice, CHROME_WINDOWS, "10.0.0.1");

      verify(events).publish(new DeviceTrusted(alice, "Chrome 120.0.0.0 on Windows 10/11", "10.0.0.1"));
    }
  }

  @Nested
  class IsTrusted {

    @Test
    void trustedDevice_isTrusted() {
      InMemoryTrustCookieJar jar = new InMemoryTrustCookieJar();
      DeviceTrustManager manager = managerFor(jar);
      manager.trust(alice, CHROME_WINDOWS, "10.0.0.1");

      assertThat(manager.isTrusted(alice, "10.0.0.2")).isTrue();
    }

    /**
     * Trusting a second device makes the first one untrusted.
     */
    @Test
    void secondDevice_replacesFirst() {
      InMemoryTrustCookieJar deviceOne = new InMemoryTrustCookieJar();
      InMemoryTrustCookieJar deviceTwo = new InMemoryTrustCookieJar();
      managerFor(deviceOne).trust(alice, CHROME_WINDOWS, null);
      managerFor(deviceTwo).trust(alice, CHROME_WINDOWS, null);

      assertThat(managerFor(deviceOne).isTrusted(alice, null)).isFalse();
      assertThat(managerFor(deviceTwo).isTrusted(alice, null)).isTrue();
    }

    @Test
    void noCookie_isNotTrusted() {
      assertThat(managerFor(new InMemoryTrustCookieJar()).isTrusted(alice, null)).isFalse();
    }

    @Test
    void unknownToken_isNotTrusted() {
      InMemoryTrustCookieJar jar = new InMemoryTrustCookieJar();
      jar.put(COOKIE, "deadbeef");

      assertThat(managerFor(jar).isTrusted(alice, null)).isFalse();
    }

    @Test
    void otherUsersToken_isNotTrusted() {
      InMemoryTrustCookieJar jar = new InMemoryTrustCookieJar();
      managerFor(jar).trust(bob, CHROME_WINDOWS, null);

      assertThat(managerFor(jar).isTrusted(alice, null)).isFalse();
    }

    @Test
    void expiredToken_isNotTrusted() {
      InMemoryTrustCookieJar jar = new InMemoryTrustCookieJar();
      managerFor(jar).trust(alice, CHROME_WINDOWS, null);

      clock.advance(Duration.ofDays(90));

      assertThat(managerFor(jar).isTrusted(alice, null)).isFalse();
    }

    @Test
    void recordsLastUse() {
      InMemoryTrustCookieJar jar = new InMemoryTrustCookieJar();
      TrustCookie cookie = managerFor(jar).trust(alice, CHROME_WINDOWS, "10.0.0.1");
      clock.advance(Duration.ofHours(1));

      managerFor(jar).isTrusted(alice, "10.0.0.9");

      DeviceToken token = tokenStore.findValidToken(DeviceToken.hashToken(cookie.value())).orElseThrow();
      assertThat(token.lastUsedAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
      assertThat(token.ip()).isEqualTo("10.0.0.9");
    }

    @Test
    void storeFailure_isNotTrusted() {
      DeviceTokenStore failing = mock(DeviceTokenStore.class);
      when(failing.findValidToken(anyString())).thenThrow(new IllegalStateException("db down"));
      InMemoryTrustCookieJar jar = new InMemoryTrustCookieJar();
      jar.put(COOKIE, "abc");

      DeviceTrustManager manager = new DeviceTrustManager(failing, sessionStore, jar, events);

      assertThat(manager.isTrusted(alice, null)).isFalse();
    }

    @Test
    void nullIdentity_isNotTrusted() {
      assertThat(managerFor(new InMemoryTrustCookieJar()).isTrusted(null, null)).isFalse();
    }
  }

  @Test
  void revoke_dropsTokenAndExpiresCookie() {
    InMemoryTrustCookieJar jar = new InMemoryTrustCookieJar();
    DeviceTrustManager manager = managerFor(jar);
    TrustCookie cookie = manager.trust(alice, CHROME_WINDOWS, null);

    manager.revoke(alice);

    assertThat(tokenStore.findValidToken(DeviceToken.hashToken(cookie.value()))).isEmpty();
    assertThat(jar.written()).last().satisfies(written -> {
      assertThat(written.maxAge()).isEqualTo(Duration.ZERO);
      assertThat(written.value()).isEmpty();
    });
    assertThat(manager.isTrusted(alice, null)).isFalse();
  }

  @Test
  void constructor_rejectsNonPositiveLifetime() {
    assertThatThrownBy(() -> new DeviceTrustManager(tokenStore, sessionStore,
        new InMemoryTrustCookieJar(), events, COOKIE, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
