package com.codeheadsystems.warden.exceptions;

/**
 * Coarse grouping of {@link ErrorKind} values, useful when a caller only needs to know whether a
 * failure came from the network, the payload, the credential, replay protection, attestation,
 * throughput limits, local storage, or the server in general.
 */
public enum ErrorGroup {
  TRANSPORT,
  SERIALIZATION,
  CREDENTIAL,
  REPLAY_PROTECTION,
  ATTESTATION,
  QUOTA,
  STORAGE,
  GENERIC
}
