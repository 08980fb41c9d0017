package com.codeheadsystems.keyid.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keyid.server.auth.GuardDriver;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KeyIdentityConfigurationLoaderTest {

  private KeyIdentityConfigurationLoader loader;

  @BeforeEach
  void setUp() {
    loader = new KeyIdentityConfigurationLoader();
  }

  private static InputStream yaml(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void loadResource_readsEveryField() {
    KeyIdentityConfiguration configuration = loader.loadResource("keyid-test.yml");

    assertThat(configuration.getNonceSecretHex()).hasSize(64);
    assertThat(configuration.getNonceTtlSeconds()).isEqualTo(120);
    assertThat(configuration.getNonceClockSkewSeconds()).isEqualTo(5);
    assertThat(configuration.isNonceReplayProtection()).isTrue();
    assertThat(configuration.getArgon2MemoryKib()).isEqualTo(1024);
    assertThat(configuration.getArgon2Iterations()).isEqualTo(1);
    assertThat(configuration.getArgon2Parallelism()).isEqualTo(1);
    assertThat(configuration.getMinPassphraseLength()).isEqualTo(10);
    assertThat(configuration.getMinUniqueChars()).isEqualTo(5);
    assertThat(configuration.getDeviceTrustDays()).isEqualTo(30);
    assertThat(configuration.getTrustCookieName()).isEqualTo("trusted_device");
    assertThat(configuration.getGuardName()).isEqualTo("web");
    assertThat(configuration.getGuardDriver()).isEqualTo(GuardDriver.KEY);
  }

  @Test
  void emptyDocument_yieldsDefaults() {
    KeyIdentityConfiguration configuration = loader.load(yaml(""));

    assertThat(configuration.getNonceSecretHex()).isEmpty();
    assertThat(configuration.getNonceTtlSeconds()).isEqualTo(300);
    assertThat(configuration.getNonceClockSkewSeconds()).isZero();
    assertThat(configuration.isNonceReplayProtection()).isFalse();
    assertThat(configuration.getArgon2MemoryKib()).isEqualTo(65536);
    assertThat(configuration.getArgon2Iterations()).isEqualTo(3);
    assertThat(configuration.getArgon2Parallelism()).isEqualTo(1);
    assertThat(configuration.getSaltKeyHex()).isEmpty();
    assertThat(configuration.getMinPassphraseLength()).isEqualTo(12);
    assertThat(configuration.getMinUniqueChars()).isEqualTo(6);
    assertThat(configuration.getDeviceTrustDays()).isEqualTo(90);
    assertThat(configuration.getTrustCookieName()).isEqualTo("device_trust_token");
    assertThat(configuration.getGuardName()).isEqualTo("key");
    assertThat(configuration.getGuardDriver()).isEqualTo(GuardDriver.KEY);
  }

  @Test
  void constraintViolations_areAllReported() {
    assertThatThrownBy(() -> loader.loadResource("keyid-invalid.yml"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("nonceTtlSeconds")
        .hasMessageContaining("argon2Iterations")
        .hasMessageContaining("trustCookieName");
  }

  @Test
  void unknownProperty_isRejected() {
    assertThatThrownBy(() -> loader.load(yaml("nonceTtlSecs: 60\n")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("nonceTtlSecs");
  }

  @Test
  void unknownGuardDriver_isRejected() {
    assertThatThrownBy(() -> loader.load(yaml("guardDriver: session\n")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nullGuardDriver_isRejected() {
    assertThatThrownBy(() -> loader.load(yaml("guardDriver: null\n")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("guardDriver");
  }

  @Test
  void missingResource_throws() {
    assertThatThrownBy(() -> loader.loadResource("does-not-exist.yml"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void loadPath_readsFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("keyid.yml");
    Files.writeString(file, "deviceTrustDays: 7\nguardName: api\n");

    KeyIdentityConfiguration configuration = loader.load(file);

    assertThat(configuration.getDeviceTrustDays()).isEqualTo(7);
    assertThat(configuration.getGuardName()).isEqualTo("api");
  }

  @Test
  void loadPath_missingFile_throws(@TempDir Path dir) {
    assertThatThrownBy(() -> loader.load(dir.resolve("missing.yml")))
        .isInstanceOf(UncheckedIOException.class);
  }
}
