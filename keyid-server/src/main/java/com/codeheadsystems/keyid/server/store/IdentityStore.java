package com.codeheadsystems.keyid.server.store;

import com.codeheadsystems.keyid.server.model.KeyIdentity;
import com.codeheadsystems.keyid.server.model.NewIdentity;
import java.util.Optional;

/**
 * Storage abstraction for key-based identities.
 * <p>
 * Implementations must be thread-safe. Typical production implementations back this with the
 * application's user table; the identity system only needs these three operations.
 */
public interface IdentityStore {

  /**
   * Looks up an identity by normalized email.
   *
   * @param email normalized (trimmed, lowercase) email
   * @return the identity, or empty if none is registered
   */
  Optional<KeyIdentity> findByIdentifier(String email);

  /**
   * Persists a new identity.
   *
   * @param fields the fields of the new identity
   * @return the stored identity, with its assigned id
   * @throws IllegalStateException if an identity with the same email already exists
   */
  KeyIdentity create(NewIdentity fields);

  /**
   * Persists changes to an existing identity (public key, prompt ids).
   *
   * @param identity the modified identity
   * @throws IllegalStateException if the identity is unknown to the store
   */
  void save(KeyIdentity identity);
}
