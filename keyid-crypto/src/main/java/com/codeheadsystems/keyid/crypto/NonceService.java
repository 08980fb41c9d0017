package com.codeheadsystems.keyid.crypto;

import com.codeheadsystems.keyid.crypto.common.ByteUtils;
import com.codeheadsystems.keyid.crypto.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.Hex;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and checks identifier-bound, time-limited challenge nonces.
 * <p>
 * Wire format: {@code <32 hex random>.<unix seconds>.<64 hex HMAC-SHA256>}. The HMAC covers
 * {@code identifier + "|" + random + "." + timestamp}, so a nonce issued for one identifier never
 * validates for another. Validation is stateless: it does not consume the nonce. Replay within
 * the TTL window is bounded only by the TTL unless a used-nonce ledger is layered on top.
 */
@Singleton
public class NonceService {

  private static final Logger log = LoggerFactory.getLogger(NonceService.class);

  public static final long DEFAULT_TTL_SECONDS = 300;
  public static final int RANDOM_BYTES = 16;
  public static final int MIN_SECRET_BYTES = 16;

  private static final Pattern NONCE_FORMAT =
      Pattern.compile("([0-9a-f]{32})\\.([0-9]{1,19})\\.([0-9a-f]{64})");

  private final byte[] secret;
  private final long ttlSeconds;
  private final long clockSkewSeconds;
  private final Clock clock;
  private final RandomProvider randomProvider;

  /**
   * Creates a nonce service with the default TTL, no future clock skew and the system clock.
   *
   * @param secret HMAC key, at least 16 bytes
   */
  public NonceService(byte[] secret) {
    this(secret, DEFAULT_TTL_SECONDS, 0, Clock.systemUTC(), new RandomProvider());
  }

  /**
   * Creates a new NonceService.
   *
   * @param secret           HMAC key, at least 16 bytes
   * @param ttlSeconds       how long a nonce stays valid after issue
   * @param clockSkewSeconds how far in the future a timestamp may be before it is rejected
   * @param clock            time source
   * @param randomProvider   entropy source for the random part
   */
  @Inject
  public NonceService(byte[] secret, long ttlSeconds, long clockSkewSeconds, Clock clock,
                      RandomProvider randomProvider) {
    if (secret == null || secret.length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException("Nonce secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    if (ttlSeconds < 1) {
      throw new IllegalArgumentException("ttlSeconds must be positive");
    }
    if (clockSkewSeconds < 0) {
      throw new IllegalArgumentException("clockSkewSeconds must not be negative");
    }
    this.secret = secret.clone();
    this.ttlSeconds = ttlSeconds;
    this.clockSkewSeconds = clockSkewSeconds;
    this.clock = clock;
    this.randomProvider = randomProvider;
  }

  /**
   * Generates a nonce bound to the given identifier.
   *
   * @param identifier the user identifier, normally the normalized email
   * @return the nonce string
   */
  public String generate(String identifier) {
    String payload = randomProvider.randomHex(RANDOM_BYTES) + "." + clock.instant().getEpochSecond();
    return payload + "." + hmacHex(identifier, payload);
  }

  /**
   * Validates a nonce for the given identifier: well-formed, within the TTL, not from the
   * future, and carrying the HMAC for this identifier.
   *
   * @return true if the nonce is acceptable
   */
  public boolean validate(String identifier, String nonce) {
    if (identifier == null || nonce == null) {
      return false;
    }
    Matcher matcher = NONCE_FORMAT.matcher(nonce);
    if (!matcher.matches()) {
      log.debug("Rejected nonce: malformed");
      return false;
    }
    long timestamp;
    try {
      timestamp = Long.parseLong(matcher.group(2));
    } catch (NumberFormatException e) {
      return false;
    }
    long now = clock.instant().getEpochSecond();
    if (now - timestamp > ttlSeconds) {
      log.debug("Rejected nonce: expired");
      return false;
    }
    if (timestamp - now > clockSkewSeconds) {
      log.debug("Rejected nonce: timestamp in the future");
      return false;
    }
    String payload = matcher.group(1) + "." + matcher.group(2);
    byte[] expected = hmacHex(identifier, payload).getBytes(StandardCharsets.US_ASCII);
    byte[] actual = matcher.group(3).getBytes(StandardCharsets.US_ASCII);
    return ByteUtils.constantTimeEquals(expected, actual);
  }

  /**
   * Returns the instant after which the nonce no longer validates. Does not check the HMAC.
   *
   * @return the expiry, or empty when the nonce is malformed
   */
  public Optional<Instant> expiresAt(String nonce) {
    if (nonce == null) {
      return Optional.empty();
    }
    Matcher matcher = NONCE_FORMAT.matcher(nonce);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.ofEpochSecond(Long.parseLong(matcher.group(2))).plusSeconds(ttlSeconds));
    } catch (NumberFormatException | DateTimeException e) {
      return Optional.empty();
    }
  }

  public long getTtlSeconds() {
    return ttlSeconds;
  }

  private String hmacHex(String identifier, String payload) {
    byte[] input = (identifier + "|" + payload).getBytes(StandardCharsets.UTF_8);
    HMac hmac = new HMac(new SHA256Digest());
    hmac.init(new KeyParameter(secret));
    hmac.update(input, 0, input.length);
    byte[] tag = new byte[hmac.getMacSize()];
    hmac.doFinal(tag, 0);
    return Hex.toHexString(tag);
  }
}
