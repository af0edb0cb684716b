package com.codeheadsystems.warden.security.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SecureStorage} backed by a {@link ConcurrentHashMap}.
 * <p>
 * The attestation key reference and counter are lost on restart, which forces a new device
 * registration. Suitable for development and testing only.
 */
public class InMemorySecureStorage implements SecureStorage {

  private static final Logger log = LoggerFactory.getLogger(InMemorySecureStorage.class);

  private final ConcurrentHashMap<String, byte[]> store = new ConcurrentHashMap<>();

  public InMemorySecureStorage() {
    log.warn("Using InMemorySecureStorage, attestation state will NOT survive restarts. "
        + "Use EncryptedFileSecureStorage for production.");
  }

  @Override
  public Optional<byte[]> read(String name) {
    byte[] value = store.get(name);
    return value == null ? Optional.empty() : Optional.of(value.clone());
  }

  @Override
  public void write(String name, byte[] value) {
    store.put(name, value.clone());
    log.debug("Stored entry {} ({} bytes)", name, value.length);
  }

  @Override
  public void delete(String name) {
    store.remove(name);
  }
}
