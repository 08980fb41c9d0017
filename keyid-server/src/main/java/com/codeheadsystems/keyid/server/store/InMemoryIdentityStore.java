package com.codeheadsystems.keyid.server.store;

import com.codeheadsystems.keyid.server.model.IdentityRecord;
import com.codeheadsystems.keyid.server.model.KeyIdentity;
import com.codeheadsystems.keyid.server.model.NewIdentity;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link IdentityStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Records are copied in and out so callers must {@link #save} to persist changes, as with a
 * real database. All identities are lost on restart. Suitable for development and testing only.
 */
public class InMemoryIdentityStore implements IdentityStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryIdentityStore.class);

  private final ConcurrentHashMap<String, IdentityRecord> byEmail = new ConcurrentHashMap<>();

  public InMemoryIdentityStore() {
    log.warn("Using InMemoryIdentityStore; identities will NOT survive restarts. "
        + "Replace with a persistent IdentityStore for production.");
  }

  @Override
  public Optional<KeyIdentity> findByIdentifier(String email) {
    IdentityRecord record = byEmail.get(email);
    return record == null ? Optional.empty() : Optional.of(IdentityRecord.copyOf(record));
  }

  @Override
  public KeyIdentity create(NewIdentity fields) {
    IdentityRecord record = new IdentityRecord(UUID.randomUUID().toString(), fields.email(),
        fields.publicKey(), fields.promptIds(), fields.attributes());
    if (byEmail.putIfAbsent(fields.email(), record) != null) {
      throw new IllegalStateException("Identity already exists");
    }
    log.debug("Created identity id={}", record.getId());
    return IdentityRecord.copyOf(record);
  }

  @Override
  public void save(KeyIdentity identity) {
    IdentityRecord updated = IdentityRecord.copyOf(identity);
    IdentityRecord current = byEmail.computeIfPresent(identity.getEmail(),
        (email, existing) -> existing.getId().equals(updated.getId()) ? updated : existing);
    if (current != updated) {
      throw new IllegalStateException("Unknown identity id=" + identity.getId());
    }
    log.debug("Saved identity id={}", identity.getId());
  }
}
