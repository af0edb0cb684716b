package com.codeheadsystems.warden.security.attestation;

/**
 * Values sent as {@code X-Attest-Key-Id}, {@code X-Attest-Assertion} and {@code X-Attest-Counter}.
 *
 * @param keyId     the attestation key id
 * @param assertion the base64 assertion
 * @param counter   the counter value the assertion was generated for
 */
public record AssertionHeaders(String keyId, String assertion, long counter) {

  @Override
  public String toString() {
    return "AssertionHeaders[keyId=" + keyId + ", counter=" + counter + "]";
  }
}
