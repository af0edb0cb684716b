package com.codeheadsystems.warden.security.store;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists the opaque identifier of the device's attestation key under one named entry of a
 * {@link SecureStorage}. The key material itself never leaves the attestation service.
 */
public class AttestationKeyStore {

  private static final Logger log = LoggerFactory.getLogger(AttestationKeyStore.class);

  private final SecureStorage storage;
  private final String entryName;

  /**
   * Instantiates a new Attestation key store.
   *
   * @param storage   the backing storage
   * @param entryName the entry holding the key id
   */
  public AttestationKeyStore(final SecureStorage storage, final String entryName) {
    this.storage = storage;
    this.entryName = entryName;
  }

  /**
   * Load.
   *
   * @return the stored key id, or empty if none has been generated
   */
  public Optional<String> load() {
    return storage.read(entryName)
        .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
        .filter(id -> !id.isEmpty());
  }

  /**
   * Store.
   *
   * @param keyId the key id
   */
  public void store(final String keyId) {
    storage.write(entryName, keyId.getBytes(StandardCharsets.UTF_8));
    log.debug("Stored attestation key reference in {}", entryName);
  }

  /**
   * Clear.
   */
  public void clear() {
    storage.delete(entryName);
    log.debug("Cleared attestation key reference in {}", entryName);
  }
}
