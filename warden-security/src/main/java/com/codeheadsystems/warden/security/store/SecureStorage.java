package com.codeheadsystems.warden.security.store;

import java.util.Optional;

/**
 * Storage abstraction for small secrets that must survive restarts and resist casual extraction:
 * the attestation key identifier and the assertion counter.
 * <p>
 * Implementations must be thread-safe. Failures to read or write are reported as
 * {@link com.codeheadsystems.warden.exceptions.WardenException} with kind
 * {@link com.codeheadsystems.warden.exceptions.ErrorKind#STORAGE_FAILURE}.
 */
public interface SecureStorage {

  /**
   * Reads the value stored under the given name.
   *
   * @param name the entry name
   * @return a copy of the stored bytes, or empty if nothing is stored
   */
  Optional<byte[]> read(String name);

  /**
   * Stores or replaces the value under the given name. The value is durable when this returns.
   *
   * @param name  the entry name
   * @param value the bytes to store
   */
  void write(String name, byte[] value);

  /**
   * Removes the entry, if present.
   *
   * @param name the entry name
   */
  void delete(String name);
}
