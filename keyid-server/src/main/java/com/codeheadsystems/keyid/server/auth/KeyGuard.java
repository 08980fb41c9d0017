package com.codeheadsystems.keyid.server.auth;

import com.codeheadsystems.keyid.crypto.KeyDerivationService;
import com.codeheadsystems.keyid.crypto.NonceService;
import com.codeheadsystems.keyid.crypto.common.ByteUtils;
import com.codeheadsystems.keyid.crypto.model.DerivedKeyPair;
import com.codeheadsystems.keyid.server.event.IdentityEvent.AuthAttempting;
import com.codeheadsystems.keyid.server.event.IdentityEvent.AuthFailed;
import com.codeheadsystems.keyid.server.event.IdentityEvent.AuthSucceeded;
import com.codeheadsystems.keyid.server.event.IdentityEventSink;
import com.codeheadsystems.keyid.server.manager.IdentityManager;
import com.codeheadsystems.keyid.server.model.KeyCredentials;
import com.codeheadsystems.keyid.server.model.KeyIdentity;
import com.codeheadsystems.keyid.server.store.UsedNonceStore;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Passwordless guard using Ed25519 challenge-response over a key derived from email and
 * passphrase.
 * <p>
 * Two flows are supported:
 * <ul>
 *   <li>{@link #attempt}: the server receives the passphrase, derives the keypair, compares the
 *   public key with the stored one, then signs a fresh nonce and verifies it.</li>
 *   <li>{@link #challenge} + {@link #authenticateWithSignature}: the client derives the key and
 *   signs the nonce itself, so the passphrase never leaves the client. Preferred when the
 *   client can run the derivation.</li>
 * </ul>
 * Every failure looks the same to the caller: {@code false}, with an {@code AuthFailed} event
 * that carries no reason.
 */
public class KeyGuard implements Guard {

  private static final Logger log = LoggerFactory.getLogger(KeyGuard.class);

  /**
   * Guard lifecycle. {@code REJECTED} is still unauthenticated; it records that the last
   * attempt failed.
   */
  public enum State {
    ANONYMOUS,
    PENDING,
    AUTHENTICATED,
    REJECTED
  }

  private final String name;
  private final IdentityManager identityManager;
  private final KeyDerivationService keyService;
  private final NonceService nonceService;
  private final UsedNonceStore usedNonceStore;
  private final IdentityEventSink events;

  private KeyIdentity user;
  private State state = State.ANONYMOUS;

  /**
   * Creates a guard without a nonce replay ledger.
   */
  public KeyGuard(String name, IdentityManager identityManager, IdentityEventSink events) {
    this(name, identityManager, null, events);
  }

  /**
   * Creates a new KeyGuard.
   *
   * @param name            guard name reported in events
   * @param identityManager source of the derivation primitives and identity lookups
   * @param usedNonceStore  replay ledger, or null to rely on the nonce TTL alone
   * @param events          event sink
   */
  public KeyGuard(String name, IdentityManager identityManager, UsedNonceStore usedNonceStore,
                  IdentityEventSink events) {
    this.name = Objects.requireNonNull(name, "name");
    this.identityManager = Objects.requireNonNull(identityManager, "identityManager");
    this.keyService = identityManager.getKeyService();
    this.nonceService = identityManager.getNonceService();
    this.usedNonceStore = usedNonceStore;
    this.events = Objects.requireNonNull(events, "events");
  }

  @Override
  public String name() {
    return name;
  }

  public State state() {
    return state;
  }

  @Override
  public boolean check() {
    return user != null;
  }

  @Override
  public Optional<KeyIdentity> user() {
    return Optional.ofNullable(user);
  }

  /**
   * Full server-side check of email and passphrase. Does not log in.
   */
  @Override
  public boolean validate(KeyCredentials credentials) {
    return verifyIdentity(credentials).isPresent();
  }

  @Override
  public boolean attempt(KeyCredentials credentials) {
    String email = credentials == null ? null : KeyDerivationService.normalizeEmail(credentials.email());
    events.publish(new AuthAttempting(name, email));

    Optional<KeyIdentity> identity = verifyIdentity(credentials);
    if (identity.isPresent()) {
      login(identity.get());
      events.publish(new AuthSucceeded(name, identity.get()));
      return true;
    }
    reject(email);
    return false;
  }

  @Override
  public void login(KeyIdentity identity) {
    this.user = Objects.requireNonNull(identity, "identity");
    this.state = State.AUTHENTICATED;
    log.debug("Guard '{}' logged in identity id={}", name, identity.getId());
  }

  @Override
  public void logout() {
    this.user = null;
    this.state = State.ANONYMOUS;
  }

  // ── Client-side signing flow ──────────────────────────────────────────────

  /**
   * Issues a challenge nonce for the identifier, to be signed by the client.
   *
   * @param identifier the email; normalized before binding
   * @return the nonce
   */
  public String challenge(String identifier) {
    if (!check()) {
      state = State.PENDING;
    }
    return nonceService.generate(KeyDerivationService.normalizeEmail(identifier));
  }

  /**
   * Authenticates with a signature produced on the client. The passphrase is never seen.
   * <p>
   * The nonce is checked first (format, TTL, identifier binding), then the signature is
   * verified against the stored public key. With a replay ledger configured the nonce is
   * consumed on success and a second use fails.
   *
   * @param email     the email the nonce was issued for
   * @param signature base64 Ed25519 signature over the nonce
   * @param nonce     the nonce from {@link #challenge}
   * @return true if authenticated
   */
  public boolean authenticateWithSignature(String email, String signature, String nonce) {
    String identifier = KeyDerivationService.normalizeEmail(email);
    events.publish(new AuthAttempting(name, identifier));

    if (!nonceService.validate(identifier, nonce)) {
      reject(identifier);
      return false;
    }
    Optional<KeyIdentity> identity = identityManager.findIdentity(identifier);
    byte[] storedPublicKey = identity.flatMap(IdentityManager::decodePublicKey).orElse(null);
    if (storedPublicKey == null || !keyService.verifySignature(storedPublicKey, signature, nonce)) {
      reject(identifier);
      return false;
    }
    if (usedNonceStore != null) {
      Instant expiresAt = nonceService.expiresAt(nonce).orElseThrow();
      if (!usedNonceStore.markUsed(nonce, expiresAt)) {
        log.debug("Guard '{}' rejected a replayed nonce", name);
        reject(identifier);
        return false;
      }
    }
    login(identity.get());
    events.publish(new AuthSucceeded(name, identity.get()));
    return true;
  }

  // ── Internal helpers ──────────────────────────────────────────────────────

  /**
   * Derives the keypair, compares public keys, then proves possession by signing a fresh nonce
   * and verifying it against the stored key. The derivation runs even for unknown emails.
   */
  private Optional<KeyIdentity> verifyIdentity(KeyCredentials credentials) {
    if (credentials == null || credentials.email() == null || credentials.passphrase() == null) {
      return Optional.empty();
    }
    String email = KeyDerivationService.normalizeEmail(credentials.email());
    Optional<KeyIdentity> identity = identityManager.findIdentity(email);
    byte[] storedPublicKey = identity.flatMap(IdentityManager::decodePublicKey).orElse(null);

    try (DerivedKeyPair keyPair = keyService.deriveKeyPair(email, credentials.passphrase())) {
      if (storedPublicKey == null
          || !ByteUtils.constantTimeEquals(storedPublicKey, keyPair.publicKey())) {
        return Optional.empty();
      }
      String nonce = nonceService.generate(email);
      String signature = keyService.signChallenge(keyPair.privateKey(), nonce);
      return keyService.verifySignature(storedPublicKey, signature, nonce) ? identity : Optional.empty();
    }
  }

  private void reject(String email) {
    if (!check()) {
      state = State.REJECTED;
    }
    events.publish(new AuthFailed(name, email));
    log.debug("Guard '{}' rejected an authentication attempt", name);
  }
}
