package com.codeheadsystems.keyid.server.config;

import com.codeheadsystems.keyid.server.auth.GuardDriver;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration for the key-based identity system.
 * <p>
 * For production, supply {@code nonceSecretHex} (a hex-encoded random value of at least 16
 * bytes) so that challenges survive restarts and validate on every server of a cluster.
 * Omitting it causes a random secret to be generated on each startup (dev/test only).
 * <p>
 * The Argon2id parameters and {@code saltKeyHex} are part of every stored public key. Changing
 * any of them after users have registered makes their passphrases derive different keys.
 * <p>
 * Generate secrets with: {@code openssl rand -hex 32}
 */
public class KeyIdentityConfiguration {

  /**
   * Hex-encoded HMAC secret for challenge nonces, at least 16 bytes.
   * Leave empty for random generation (dev only, outstanding nonces become invalid on restart).
   */
  private String nonceSecretHex = "";

  /**
   * How long a nonce validates after it was issued.
   */
  @Min(1)
  private long nonceTtlSeconds = 300;

  /**
   * How far a nonce timestamp may lie in the future before it is rejected. Raise it only when
   * several servers with drifting clocks share one nonce secret.
   */
  @Min(0)
  private long nonceClockSkewSeconds = 0;

  /**
   * Consume nonces on successful signature authentication so each one works only once.
   * Requires a shared used-nonce store when more than one server is deployed.
   */
  private boolean nonceReplayProtection = false;

  /**
   * Argon2id memory cost in kibibytes.
   */
  @Min(8)
  private int argon2MemoryKib = 65536;

  /**
   * Argon2id iteration count.
   */
  @Min(1)
  private int argon2Iterations = 3;

  /**
   * Argon2id parallelism.
   */
  @Min(1)
  private int argon2Parallelism = 1;

  /**
   * Hex-encoded key (at most 64 bytes) for the keyed BLAKE2b email salt. Empty means unkeyed.
   * Changing it invalidates every registered key.
   */
  private String saltKeyHex = "";

  /**
   * Minimum passphrase length in characters.
   */
  @Min(1)
  private int minPassphraseLength = 12;

  /**
   * Minimum number of distinct characters in a passphrase.
   */
  @Min(1)
  private int minUniqueChars = 6;

  /**
   * Lifetime of a trusted device token and its cookie.
   */
  @Min(1)
  private long deviceTrustDays = 90;

  /**
   * Name of the device trust cookie.
   */
  @NotEmpty
  private String trustCookieName = "device_trust_token";

  /**
   * Name reported by the guard in authentication events.
   */
  @NotEmpty
  private String guardName = "key";

  /**
   * Which guard implementation the module builds.
   */
  @NotNull
  private GuardDriver guardDriver = GuardDriver.KEY;

  /**
   * Gets nonce secret hex.
   *
   * @return the nonce secret hex
   */
  @JsonProperty
  public String getNonceSecretHex() {
    return nonceSecretHex;
  }

  /**
   * Sets nonce secret hex.
   *
   * @param nonceSecretHex the nonce secret hex
   */
  @JsonProperty
  public void setNonceSecretHex(String nonceSecretHex) {
    this.nonceSecretHex = nonceSecretHex;
  }

  /**
   * Gets nonce ttl seconds.
   *
   * @return the nonce ttl seconds
   */
  @JsonProperty
  public long getNonceTtlSeconds() {
    return nonceTtlSeconds;
  }

  /**
   * Sets nonce ttl seconds.
   *
   * @param nonceTtlSeconds the nonce ttl seconds
   */
  @JsonProperty
  public void setNonceTtlSeconds(long nonceTtlSeconds) {
    this.nonceTtlSeconds = nonceTtlSeconds;
  }

  /**
   * Gets nonce clock skew seconds.
   *
   * @return the nonce clock skew seconds
   */
  @JsonProperty
  public long getNonceClockSkewSeconds() {
    return nonceClockSkewSeconds;
  }

  /**
   * Sets nonce clock skew seconds.
   *
   * @param nonceClockSkewSeconds the nonce clock skew seconds
   */
  @JsonProperty
  public void setNonceClockSkewSeconds(long nonceClockSkewSeconds) {
    this.nonceClockSkewSeconds = nonceClockSkewSeconds;
  }

  /**
   * Gets nonce replay protection.
   *
   * @return the nonce replay protection
   */
  @JsonProperty
  public boolean isNonceReplayProtection() {
    return nonceReplayProtection;
  }

  /**
   * Sets nonce replay protection.
   *
   * @param nonceReplayProtection the nonce replay protection
   */
  @JsonProperty
  public void setNonceReplayProtection(boolean nonceReplayProtection) {
    this.nonceReplayProtection = nonceReplayProtection;
  }

  /**
   * Gets argon 2 memory kib.
   *
   * @return the argon 2 memory kib
   */
  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  /**
   * Sets argon 2 memory kib.
   *
   * @param argon2MemoryKib the argon 2 memory kib
   */
  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  /**
   * Gets argon 2 iterations.
   *
   * @return the argon 2 iterations
   */
  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  /**
   * Sets argon 2 iterations.
   *
   * @param argon2Iterations the argon 2 iterations
   */
  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  /**
   * Gets argon 2 parallelism.
   *
   * @return the argon 2 parallelism
   */
  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  /**
   * Sets argon 2 parallelism.
   *
   * @param argon2Parallelism the argon 2 parallelism
   */
  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  /**
   * Gets salt key hex.
   *
   * @return the salt key hex
   */
  @JsonProperty
  public String getSaltKeyHex() {
    return saltKeyHex;
  }

  /**
   * Sets salt key hex.
   *
   * @param saltKeyHex the salt key hex
   */
  @JsonProperty
  public void setSaltKeyHex(String saltKeyHex) {
    this.saltKeyHex = saltKeyHex;
  }

  /**
   * Gets min passphrase length.
   *
   * @return the min passphrase length
   */
  @JsonProperty
  public int getMinPassphraseLength() {
    return minPassphraseLength;
  }

  /**
   * Sets min passphrase length.
   *
   * @param minPassphraseLength the min passphrase length
   */
  @JsonProperty
  public void setMinPassphraseLength(int minPassphraseLength) {
    this.minPassphraseLength = minPassphraseLength;
  }

  /**
   * Gets min unique chars.
   *
   * @return the min unique chars
   */
  @JsonProperty
  public int getMinUniqueChars() {
    return minUniqueChars;
  }

  /**
   * Sets min unique chars.
   *
   * @param minUniqueChars the min unique chars
   */
  @JsonProperty
  public void setMinUniqueChars(int minUniqueChars) {
    this.minUniqueChars = minUniqueChars;
  }

  /**
   * Gets device trust days.
   *
   * @return the device trust days
   */
  @JsonProperty
  public long getDeviceTrustDays() {
    return deviceTrustDays;
  }

  /**
   * Sets device trust days.
   *
   * @param deviceTrustDays the device trust days
   */
  @JsonProperty
  public void setDeviceTrustDays(long deviceTrustDays) {
    this.deviceTrustDays = deviceTrustDays;
  }

  /**
   * Gets trust cookie name.
   *
   * @return the trust cookie name
   */
  @JsonProperty
  public String getTrustCookieName() {
    return trustCookieName;
  }

  /**
   * Sets trust cookie name.
   *
   * @param trustCookieName the trust cookie name
   */
  @JsonProperty
  public void setTrustCookieName(String trustCookieName) {
    this.trustCookieName = trustCookieName;
  }

  /**
   * Gets guard name.
   *
   * @return the guard name
   */
  @JsonProperty
  public String getGuardName() {
    return guardName;
  }

  /**
   * Sets guard name.
   *
   * @param guardName the guard name
   */
  @JsonProperty
  public void setGuardName(String guardName) {
    this.guardName = guardName;
  }

  /**
   * Gets guard driver.
   *
   * @return the guard driver
   */
  @JsonProperty
  public GuardDriver getGuardDriver() {
    return guardDriver;
  }

  /**
   * Sets guard driver.
   *
   * @param guardDriver the guard driver
   */
  @JsonProperty
  public void setGuardDriver(GuardDriver guardDriver) {
    this.guardDriver = guardDriver;
  }
}
