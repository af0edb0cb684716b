package com.codeheadsystems.warden.security.attestation;

/**
 * Which attestation variant a provider implements.
 */
public enum AttestationMode {
  HARDWARE,
  SIMULATOR
}
