package com.codeheadsystems.warden.security.attestation;

/**
 * Result of attesting the device key against a server challenge.
 *
 * @param keyId             the attested key id
 * @param attestationObject the base64 attestation object
 */
public record AttestedKey(String keyId, String attestationObject) {
}
