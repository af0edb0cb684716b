package com.codeheadsystems.warden.security.attestation;

/**
 * Bridge to a hardware-backed key attestation service (a secure enclave, TPM or similar). The
 * private key never leaves the platform; callers only see its opaque identifier.
 */
public interface PlatformAttestationService {

  /**
   * Is supported.
   *
   * @return true if the platform can generate and attest hardware keys
   */
  boolean isSupported();

  /**
   * Generates a new hardware key.
   *
   * @return the key id
   * @throws PlatformAttestationException if the platform refuses
   */
  String generateKey() throws PlatformAttestationException;

  /**
   * Attests a key, binding it to the client data hash.
   *
   * @param keyId          the key id
   * @param clientDataHash SHA-256 of the server challenge
   * @return the raw attestation object
   * @throws PlatformAttestationException if the platform refuses
   */
  byte[] attestKey(String keyId, byte[] clientDataHash) throws PlatformAttestationException;

  /**
   * Signs a client data hash with an attested key.
   *
   * @param keyId          the key id
   * @param clientDataHash the hash to sign
   * @return the raw assertion
   * @throws PlatformAttestationException if the platform refuses
   */
  byte[] generateAssertion(String keyId, byte[] clientDataHash) throws PlatformAttestationException;
}
