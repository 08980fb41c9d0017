package com.codeheadsystems.keyid.server.manager;

import com.codeheadsystems.keyid.crypto.KeyDerivationService;
import com.codeheadsystems.keyid.crypto.NonceService;
import com.codeheadsystems.keyid.crypto.common.ByteUtils;
import com.codeheadsystems.keyid.crypto.model.DerivedKeyPair;
import com.codeheadsystems.keyid.crypto.model.EntropyResult;
import com.codeheadsystems.keyid.server.event.IdentityEvent.IdentityRecovered;
import com.codeheadsystems.keyid.server.event.IdentityEvent.IdentityRegistered;
import com.codeheadsystems.keyid.server.event.IdentityEventSink;
import com.codeheadsystems.keyid.server.exceptions.PassphraseValidationException;
import com.codeheadsystems.keyid.server.model.KeyIdentity;
import com.codeheadsystems.keyid.server.model.NewIdentity;
import com.codeheadsystems.keyid.server.store.IdentityStore;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic orchestration of the key-based identity flows: registration,
 * verification and recovery.
 * <p>
 * Only the public key ever reaches the {@link IdentityStore}. Derived private material lives
 * inside try-with-resources blocks and is wiped on every exit path.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link PassphraseValidationException}: passphrase below the entropy floor (register, recover)</li>
 *   <li>{@link IllegalStateException}: email already registered (register)</li>
 *   <li>{@link IllegalArgumentException}: blank email (register)</li>
 * </ul>
 * Verification never throws for bad credentials; it returns empty.
 */
@Singleton
public class IdentityManager {

  private static final Logger log = LoggerFactory.getLogger(IdentityManager.class);
  private static final Base64.Encoder B64 = Base64.getEncoder();

  private final KeyDerivationService keyService;
  private final NonceService nonceService;
  private final IdentityStore identityStore;
  private final IdentityEventSink events;
  private final int minPassphraseLength;
  private final int minUniqueChars;

  /**
   * Creates a manager with the default entropy floor (12 characters, 6 unique).
   */
  public IdentityManager(KeyDerivationService keyService, NonceService nonceService,
                         IdentityStore identityStore, IdentityEventSink events) {
    this(keyService, nonceService, identityStore, events,
        KeyDerivationService.DEFAULT_MIN_LENGTH, KeyDerivationService.DEFAULT_MIN_UNIQUE_CHARS);
  }

  /**
   * Creates a new IdentityManager.
   *
   * @param keyService          key derivation and signing
   * @param nonceService        challenge issuing
   * @param identityStore       user-record store, required
   * @param events              event sink, required (use {@link IdentityEventSink#discarding()})
   * @param minPassphraseLength entropy floor: minimum length
   * @param minUniqueChars      entropy floor: minimum unique characters
   */
  @Inject
  public IdentityManager(KeyDerivationService keyService, NonceService nonceService,
                         IdentityStore identityStore, IdentityEventSink events,
                         int minPassphraseLength, int minUniqueChars) {
    this.keyService = Objects.requireNonNull(keyService, "keyService");
    this.nonceService = Objects.requireNonNull(nonceService, "nonceService");
    this.identityStore = Objects.requireNonNull(identityStore, "identityStore");
    this.events = Objects.requireNonNull(events, "events");
    this.minPassphraseLength = minPassphraseLength;
    this.minUniqueChars = minUniqueChars;
  }

  // ── Registration ─────────────────────────────────────────────────────────

  public KeyIdentity register(String email, String passphrase) {
    return register(email, passphrase, List.of(), Map.of());
  }

  public KeyIdentity register(String email, String passphrase, List<String> promptIds) {
    return register(email, passphrase, promptIds, Map.of());
  }

  /**
   * Registers a new identity and stores only its public key.
   *
   * @param email      the user's email
   * @param passphrase the secret passphrase or joined prompt answers
   * @param promptIds  recovery-prompt identifiers for the client UI, possibly empty
   * @param attributes extra profile fields, possibly empty
   * @return the created identity
   * @throws PassphraseValidationException if the passphrase is too weak
   * @throws IllegalStateException         if the email is already registered
   */
  public KeyIdentity register(String email, String passphrase, List<String> promptIds,
                              Map<String, String> attributes) {
    log.debug("register()");
    requireEntropy(passphrase);
    String normalizedEmail = KeyDerivationService.normalizeEmail(email);
    if (normalizedEmail.isEmpty()) {
      throw new IllegalArgumentException("Email is required");
    }
    if (identityStore.findByIdentifier(normalizedEmail).isPresent()) {
      throw new IllegalStateException("Identity already registered");
    }

    byte[] publicKey = keyService.derivePublicKey(normalizedEmail, passphrase);
    try {
      String publicKeyEncoded = B64.encodeToString(publicKey);
      KeyIdentity identity = identityStore.create(
          new NewIdentity(normalizedEmail, publicKeyEncoded, promptIds, attributes));
      events.publish(new IdentityRegistered(identity, publicKeyEncoded));
      log.info("Registered identity id={}", identity.getId());
      return identity;
    } finally {
      ByteUtils.wipe(publicKey);
    }
  }

  // ── Verification ─────────────────────────────────────────────────────────

  /**
   * Verifies a passphrase by re-deriving the keypair and comparing public keys in constant time.
   * <p>
   * When the email is unknown the derivation still runs, so unknown and wrong-passphrase
   * failures cost the same.
   *
   * @return the identity on a match, empty otherwise
   */
  public Optional<KeyIdentity> verify(String email, String passphrase) {
    String normalizedEmail = KeyDerivationService.normalizeEmail(email);
    Optional<KeyIdentity> identity = findIdentity(normalizedEmail);
    byte[] storedPublicKey = identity.flatMap(IdentityManager::decodePublicKey).orElse(null);

    try (DerivedKeyPair keyPair = keyService.deriveKeyPair(normalizedEmail, passphrase)) {
      if (storedPublicKey == null) {
        return Optional.empty();
      }
      boolean matches = ByteUtils.constantTimeEquals(storedPublicKey, keyPair.publicKey());
      return matches ? identity : Optional.empty();
    }
  }

  /**
   * Looks up an identity by email, normalizing it first.
   */
  public Optional<KeyIdentity> findIdentity(String email) {
    return identityStore.findByIdentifier(KeyDerivationService.normalizeEmail(email));
  }

  /**
   * Decodes the stored public key of an identity.
   *
   * @return the raw key, or empty when missing or not valid base64 of 32 bytes
   */
  public static Optional<byte[]> decodePublicKey(KeyIdentity identity) {
    String encoded = identity.getPublicKey();
    if (encoded == null || encoded.isEmpty()) {
      return Optional.empty();
    }
    try {
      byte[] raw = Base64.getDecoder().decode(encoded);
      if (raw.length != KeyDerivationService.PUBLIC_KEY_BYTES) {
        log.warn("Stored public key for identity id={} has {} bytes", identity.getId(), raw.length);
        return Optional.empty();
      }
      return Optional.of(raw);
    } catch (IllegalArgumentException e) {
      log.warn("Stored public key for identity id={} is not valid base64", identity.getId());
      return Optional.empty();
    }
  }

  // ── Recovery ─────────────────────────────────────────────────────────────

  public void recover(KeyIdentity identity, String newPassphrase) {
    recover(identity, newPassphrase, List.of());
  }

  /**
   * Replaces the identity's key with one derived from a new passphrase.
   * <p>
   * The caller must already have authenticated the user out of band (an emailed link, for
   * instance). This method does not check that.
   *
   * @param identity      the identity to recover
   * @param newPassphrase the new passphrase
   * @param newPromptIds  replacement prompt identifiers; empty keeps the current ones
   * @throws PassphraseValidationException if the new passphrase is too weak
   */
  public void recover(KeyIdentity identity, String newPassphrase, List<String> newPromptIds) {
    Objects.requireNonNull(identity, "identity");
    log.debug("recover(id={})", identity.getId());
    requireEntropy(newPassphrase);

    byte[] publicKey = keyService.derivePublicKey(identity.getEmail(), newPassphrase);
    try {
      String publicKeyEncoded = B64.encodeToString(publicKey);
      identity.setPublicKey(publicKeyEncoded);
      if (newPromptIds != null && !newPromptIds.isEmpty()) {
        identity.setPromptIds(newPromptIds);
      }
      identityStore.save(identity);
      events.publish(new IdentityRecovered(identity, publicKeyEncoded));
      log.info("Recovered identity id={}", identity.getId());
    } finally {
      ByteUtils.wipe(publicKey);
    }
  }

  // ── Challenges ───────────────────────────────────────────────────────────

  /**
   * Issues a challenge nonce bound to the normalized email.
   */
  public String challenge(String email) {
    return nonceService.generate(KeyDerivationService.normalizeEmail(email));
  }

  /**
   * Checks a passphrase against the configured floor without registering anything.
   */
  public EntropyResult checkPassphrase(String passphrase) {
    return keyService.validatePassphraseEntropy(passphrase, minPassphraseLength, minUniqueChars);
  }

  public KeyDerivationService getKeyService() {
    return keyService;
  }

  public NonceService getNonceService() {
    return nonceService;
  }

  private void requireEntropy(String passphrase) {
    EntropyResult result = checkPassphrase(passphrase);
    if (!result.valid()) {
      throw new PassphraseValidationException(result.errors());
    }
  }
}
