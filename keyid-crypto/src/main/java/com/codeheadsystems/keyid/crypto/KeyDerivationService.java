package com.codeheadsystems.keyid.crypto;

import com.codeheadsystems.keyid.crypto.common.ByteUtils;
import com.codeheadsystems.keyid.crypto.config.KeyDerivationConfig;
import com.codeheadsystems.keyid.crypto.model.DerivedKeyPair;
import com.codeheadsystems.keyid.crypto.model.EntropyResult;
import java.nio.charset.StandardCharsets;
import java.text.BreakIterator;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.math.ec.rfc8032.Ed25519;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a deterministic Ed25519 keypair from an email and a passphrase, and signs and
 * verifies challenges with it.
 * <p>
 * Derivation pipeline:
 * <ol>
 *   <li>salt = BLAKE2b-128(normalized email), optionally keyed</li>
 *   <li>seed = Argon2id(normalized passphrase, salt), 32 bytes</li>
 *   <li>keypair = Ed25519 keypair expanded from the seed</li>
 * </ol>
 * Identical inputs always produce the identical keypair. Nothing is stored or logged: the
 * caller owns the returned {@link DerivedKeyPair} and must close it.
 * <p>
 * Verification never throws. Malformed input of any kind yields {@code false} so callers can
 * treat every failure the same way.
 */
@Singleton
public class KeyDerivationService {

  private static final Logger log = LoggerFactory.getLogger(KeyDerivationService.class);

  public static final int PUBLIC_KEY_BYTES = Ed25519.PUBLIC_KEY_SIZE;
  public static final int PRIVATE_KEY_BYTES = Ed25519.SECRET_KEY_SIZE + Ed25519.PUBLIC_KEY_SIZE;
  public static final int SIGNATURE_BYTES = Ed25519.SIGNATURE_SIZE;

  public static final int DEFAULT_MIN_LENGTH = 12;
  public static final int DEFAULT_MIN_UNIQUE_CHARS = 6;

  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
  private static final byte[] SELF_TEST_INPUT = "keyid-self-test".getBytes(StandardCharsets.US_ASCII);

  private final KeyDerivationConfig config;

  /**
   * Creates a service with {@link KeyDerivationConfig#DEFAULT}.
   */
  public KeyDerivationService() {
    this(KeyDerivationConfig.DEFAULT);
  }

  /**
   * Creates a service and checks that the BLAKE2b, Argon2id and Ed25519 primitives work.
   *
   * @param config derivation cost parameters
   * @throws IllegalStateException if any of the primitives is unavailable or broken
   */
  @Inject
  public KeyDerivationService(KeyDerivationConfig config) {
    this.config = config;
    selfTest();
    log.debug("KeyDerivationService ready (argon2id m={}KiB t={} p={}, keyedSalt={})",
        config.argon2Memory(), config.argon2Iterations(), config.argon2Parallelism(),
        config.saltKey().length > 0);
  }

  public KeyDerivationConfig config() {
    return config;
  }

  /**
   * Derives the keypair for {@code (email, passphrase)}.
   *
   * @param email      the user's email, normalized before use
   * @param passphrase the secret passphrase or concatenated prompt answers
   * @return the keypair; close it as soon as the signature or public key has been extracted
   */
  public DerivedKeyPair deriveKeyPair(String email, String passphrase) {
    byte[] salt = emailSalt(normalizeEmail(email));
    byte[] password = normalizePassphrase(passphrase).getBytes(StandardCharsets.UTF_8);
    byte[] seed = new byte[KeyDerivationConfig.SEED_BYTES];
    byte[] publicKey = new byte[PUBLIC_KEY_BYTES];
    byte[] privateKey = null;
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(config.argon2Memory())
        .withIterations(config.argon2Iterations())
        .withParallelism(config.argon2Parallelism())
        .build();
    try {
      Argon2BytesGenerator gen = new Argon2BytesGenerator();
      gen.init(params);
      gen.generateBytes(password, seed, 0, seed.length);
      Ed25519.generatePublicKey(seed, 0, publicKey, 0);
      privateKey = ByteUtils.concat(seed, publicKey);
      return new DerivedKeyPair(seed, privateKey, publicKey);
    } catch (RuntimeException e) {
      ByteUtils.wipe(seed, privateKey);
      throw e;
    } finally {
      ByteUtils.wipe(password);
      params.clear();
    }
  }

  /**
   * Derives only the public key. The private key and seed are wiped before returning.
   *
   * @return the raw 32-byte public key
   */
  public byte[] derivePublicKey(String email, String passphrase) {
    try (DerivedKeyPair keyPair = deriveKeyPair(email, passphrase)) {
      return keyPair.publicKey();
    }
  }

  /**
   * Signs the nonce bytes with a detached Ed25519 signature.
   *
   * @param privateKey 64-byte expanded private key, or the 32-byte seed
   * @param nonce      challenge string
   * @return base64-encoded 64-byte signature
   */
  public String signChallenge(byte[] privateKey, String nonce) {
    if (privateKey == null
        || (privateKey.length != PRIVATE_KEY_BYTES && privateKey.length != Ed25519.SECRET_KEY_SIZE)) {
      throw new IllegalArgumentException("Private key must be 32 or 64 bytes");
    }
    byte[] message = nonce.getBytes(StandardCharsets.UTF_8);
    byte[] signature = new byte[SIGNATURE_BYTES];
    Ed25519.sign(privateKey, 0, message, 0, message.length, signature, 0);
    return Base64.getEncoder().encodeToString(signature);
  }

  /**
   * Verifies a detached signature over the nonce.
   *
   * @param publicKey raw 32-byte public key
   * @param signature base64-encoded signature
   * @param nonce     challenge string that was signed
   * @return true only for a well-formed, valid signature
   */
  public boolean verifySignature(byte[] publicKey, String signature, String nonce) {
    if (publicKey == null || signature == null || nonce == null) {
      return false;
    }
    byte[] signatureRaw;
    try {
      signatureRaw = Base64.getDecoder().decode(signature);
    } catch (IllegalArgumentException e) {
      return false;
    }
    if (signatureRaw.length != SIGNATURE_BYTES) {
      return false;
    }
    if (publicKey.length != PUBLIC_KEY_BYTES) {
      return false;
    }
    byte[] message = nonce.getBytes(StandardCharsets.UTF_8);
    try {
      return Ed25519.verify(signatureRaw, 0, publicKey, 0, message, 0, message.length);
    } catch (RuntimeException e) {
      log.debug("Signature verification rejected malformed input: {}", e.getClass().getSimpleName());
      return false;
    }
  }

  /**
   * Checks the passphrase against the default floor of 12 characters and 6 unique characters.
   */
  public EntropyResult validatePassphraseEntropy(String passphrase) {
    return validatePassphraseEntropy(passphrase, DEFAULT_MIN_LENGTH, DEFAULT_MIN_UNIQUE_CHARS);
  }

  /**
   * Heuristic entropy floor: a minimum length in code points and a minimum number of distinct
   * user-perceived characters (grapheme clusters). Not a real entropy estimate.
   */
  public EntropyResult validatePassphraseEntropy(String passphrase, int minLength, int minUniqueChars) {
    String value = passphrase == null ? "" : passphrase;
    List<String> errors = new ArrayList<>();
    if (value.codePointCount(0, value.length()) < minLength) {
      errors.add("Passphrase must be at least " + minLength + " characters.");
    }
    if (countUniqueGraphemes(value) < minUniqueChars) {
      errors.add("Passphrase must contain at least " + minUniqueChars + " unique characters.");
    }
    return EntropyResult.of(errors);
  }

  /**
   * Lowercases and trims an email so derivation and lookups agree on one form.
   */
  public static String normalizeEmail(String email) {
    return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Trims, NFC-normalizes and collapses whitespace runs to a single space.
   */
  static String normalizePassphrase(String passphrase) {
    String normalized = passphrase == null ? "" : passphrase.trim();
    normalized = Normalizer.normalize(normalized, Normalizer.Form.NFC);
    return WHITESPACE_RUN.matcher(normalized).replaceAll(" ");
  }

  private byte[] emailSalt(String normalizedEmail) {
    byte[] key = config.saltKey().length == 0 ? null : config.saltKey();
    Blake2bDigest digest = new Blake2bDigest(key, KeyDerivationConfig.SALT_BYTES, null, null);
    byte[] input = normalizedEmail.getBytes(StandardCharsets.UTF_8);
    digest.update(input, 0, input.length);
    byte[] salt = new byte[KeyDerivationConfig.SALT_BYTES];
    digest.doFinal(salt, 0);
    return salt;
  }

  private static int countUniqueGraphemes(String value) {
    Set<String> graphemes = new HashSet<>();
    BreakIterator it = BreakIterator.getCharacterInstance(Locale.ROOT);
    it.setText(value);
    int start = it.first();
    for (int end = it.next(); end != BreakIterator.DONE; start = end, end = it.next()) {
      graphemes.add(value.substring(start, end));
    }
    return graphemes.size();
  }

  private static void selfTest() {
    try {
      checkBlake2b();
      checkArgon2id();
      checkEd25519();
    } catch (LinkageError e) {
      throw new IllegalStateException(
          "BouncyCastle (bcprov) is required for key-based identity authentication", e);
    }
  }

  /**
   * Two different inputs must give two different, stable 16-byte digests.
   */
  static void checkBlake2b() {
    byte[] first = blake2b(SELF_TEST_INPUT);
    byte[] other = blake2b(new byte[0]);
    if (!Arrays.equals(first, blake2b(SELF_TEST_INPUT)) || Arrays.equals(first, other)) {
      throw new IllegalStateException("BLAKE2b self-test failed");
    }
  }

  /**
   * Runs Argon2id at its minimum cost: output must be stable and depend on the salt.
   */
  static void checkArgon2id() {
    byte[] salt = new byte[KeyDerivationConfig.SALT_BYTES];
    byte[] first = argon2id(salt);
    salt[0] = 1;
    byte[] other = argon2id(salt);
    salt[0] = 0;
    boolean ok = Arrays.equals(first, argon2id(salt))
        && !Arrays.equals(first, other)
        && !Arrays.equals(first, new byte[first.length]);
    if (!ok) {
      throw new IllegalStateException("Argon2id self-test failed");
    }
  }

  static void checkEd25519() {
    byte[] seed = new byte[Ed25519.SECRET_KEY_SIZE];
    try {
      Ed25519.precompute();
      byte[] publicKey = new byte[Ed25519.PUBLIC_KEY_SIZE];
      byte[] signature = new byte[Ed25519.SIGNATURE_SIZE];
      seed[0] = 1;
      Ed25519.generatePublicKey(seed, 0, publicKey, 0);
      Ed25519.sign(seed, 0, SELF_TEST_INPUT, 0, SELF_TEST_INPUT.length, signature, 0);
      if (!Ed25519.verify(signature, 0, publicKey, 0, SELF_TEST_INPUT, 0, SELF_TEST_INPUT.length)) {
        throw new IllegalStateException("Ed25519 self-test failed: signature did not verify");
      }
    } finally {
      ByteUtils.wipe(seed);
    }
  }

  private static byte[] blake2b(byte[] input) {
    Blake2bDigest digest = new Blake2bDigest(null, KeyDerivationConfig.SALT_BYTES, null, null);
    digest.update(input, 0, input.length);
    byte[] out = new byte[KeyDerivationConfig.SALT_BYTES];
    digest.doFinal(out, 0);
    return out;
  }

  private static byte[] argon2id(byte[] salt) {
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(8)
        .withIterations(1)
        .withParallelism(1)
        .build();
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    gen.init(params);
    byte[] out = new byte[KeyDerivationConfig.SEED_BYTES];
    gen.generateBytes(SELF_TEST_INPUT, out, 0, out.length);
    return out;
  }
}
