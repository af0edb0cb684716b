package com.codeheadsystems.warden.security.attestation;

import java.util.Optional;

/**
 * Proves that requests come from a genuine install of the application.
 * <p>
 * Implementations keep the key id in an {@link com.codeheadsystems.warden.security.store.AttestationKeyStore};
 * they are not synchronized themselves, callers go through {@link AttestationManager}.
 */
public interface AttestationProvider {

  /**
   * Is supported.
   *
   * @return true if this provider can attest on the current platform
   */
  boolean isSupported();

  /**
   * Gets key id.
   *
   * @return the persisted key id, if a key has been generated
   */
  Optional<String> getKeyId();

  /**
   * Returns the existing key id, generating and persisting a key when there is none.
   *
   * @return the key id
   */
  String ensureKeyExists();

  /**
   * Attests the device key against a server challenge.
   *
   * @param challengeBase64 the base64 challenge from the server
   * @return the base64 attestation object
   */
  String attestKey(String challengeBase64);

  /**
   * Generates an assertion over {@code SHA256(body ++ bigEndian64(counter))}.
   *
   * @param body    the serialized request body
   * @param counter the replay counter value
   * @return the base64 assertion
   */
  String generateAssertion(byte[] body, long counter);

  /**
   * Forgets the local key reference. The next registration generates a new key.
   */
  void clearAttestation();

  /**
   * Mode.
   *
   * @return the variant, for diagnostics
   */
  AttestationMode mode();
}
