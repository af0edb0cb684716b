package com.codeheadsystems.warden.exceptions;

import java.util.Map;
import java.util.Optional;

/**
 * Closed set of failure kinds surfaced by the client.
 * <p>
 * Server error responses carry a machine-readable {@code error.code}; {@link #fromServerCode(String)}
 * maps those codes onto kinds. Codes the client does not recognize fall back to a status-code based
 * mapping done by the caller.
 */
public enum ErrorKind {

  // ── Transport ─────────────────────────────────────────────────────────────
  TIMEOUT(ErrorGroup.TRANSPORT, "Request timed out"),
  NETWORK_FAILURE(ErrorGroup.TRANSPORT, "Network error"),
  STREAM_INTERRUPTED(ErrorGroup.TRANSPORT, "Stream was interrupted"),

  // ── Serialization ─────────────────────────────────────────────────────────
  ENCODING_FAILED(ErrorGroup.SERIALIZATION, "Failed to encode request"),
  DECODING_FAILED(ErrorGroup.SERIALIZATION, "Failed to decode response"),

  // ── Credential / identity ─────────────────────────────────────────────────
  INVALID_CREDENTIAL(ErrorGroup.CREDENTIAL, "Invalid or missing API key"),
  INVALID_APP_IDENTITY(ErrorGroup.CREDENTIAL, "Invalid application identifier for this project"),
  INVALID_TEAM_IDENTITY(ErrorGroup.CREDENTIAL, "Invalid team identifier for this project"),

  // ── Replay protection ─────────────────────────────────────────────────────
  TIMESTAMP_EXPIRED(ErrorGroup.REPLAY_PROTECTION, "Request timestamp is outside acceptable window"),
  NONCE_REUSED(ErrorGroup.REPLAY_PROTECTION, "Request nonce has already been used"),
  INVALID_SIGNATURE(ErrorGroup.REPLAY_PROTECTION, "Invalid request signature"),

  // ── Attestation ───────────────────────────────────────────────────────────
  ATTESTATION_REQUIRED(ErrorGroup.ATTESTATION, "Device attestation is required for API access"),
  DEVICE_NOT_REGISTERED(ErrorGroup.ATTESTATION, "Device is not registered"),
  INVALID_ATTESTATION(ErrorGroup.ATTESTATION, "Device attestation is invalid or verification failed"),
  ATTESTATION_REVOKED(ErrorGroup.ATTESTATION, "Device attestation has been revoked"),
  ATTESTATION_UNSUPPORTED(ErrorGroup.ATTESTATION, "Device attestation is not supported on this platform"),
  ATTESTATION_FAILED(ErrorGroup.ATTESTATION, "Device attestation failed"),
  ATTESTATION_KEY_MISSING(ErrorGroup.ATTESTATION, "No attestation key found, the key must be attested first"),
  SIMULATOR_NOT_ALLOWED(ErrorGroup.ATTESTATION, "Simulated attestation is not allowed on the production API"),

  // ── Quota / throughput ────────────────────────────────────────────────────
  RATE_LIMITED(ErrorGroup.QUOTA, "Rate limit exceeded"),
  QUOTA_EXCEEDED(ErrorGroup.QUOTA, "Quota exceeded"),
  INSUFFICIENT_BALANCE(ErrorGroup.QUOTA, "Insufficient credits"),

  // ── Local storage ─────────────────────────────────────────────────────────
  STORAGE_FAILURE(ErrorGroup.STORAGE, "Secure storage could not be read or written"),

  // ── Generic ───────────────────────────────────────────────────────────────
  MALFORMED_REQUEST(ErrorGroup.GENERIC, "Invalid request"),
  SERVER_ERROR(ErrorGroup.GENERIC, "Server error"),
  HTTP_ERROR(ErrorGroup.GENERIC, "HTTP error"),
  UNKNOWN(ErrorGroup.GENERIC, "Unknown error");

  private static final Map<String, ErrorKind> SERVER_CODES = Map.ofEntries(
      Map.entry("rate_limit_exceeded", RATE_LIMITED),
      Map.entry("quota_exceeded", QUOTA_EXCEEDED),
      Map.entry("insufficient_credits", INSUFFICIENT_BALANCE),
      Map.entry("invalid_api_key", INVALID_CREDENTIAL),
      Map.entry("missing_api_key", INVALID_CREDENTIAL),
      Map.entry("invalid_signature", INVALID_SIGNATURE),
      Map.entry("missing_signature_headers", INVALID_SIGNATURE),
      Map.entry("timestamp_expired", TIMESTAMP_EXPIRED),
      Map.entry("invalid_timestamp", TIMESTAMP_EXPIRED),
      Map.entry("nonce_reused", NONCE_REUSED),
      Map.entry("invalid_bundle_id", INVALID_APP_IDENTITY),
      Map.entry("invalid_team_id", INVALID_TEAM_IDENTITY),
      Map.entry("attestation_required", ATTESTATION_REQUIRED),
      Map.entry("device_not_registered", DEVICE_NOT_REGISTERED),
      Map.entry("invalid_attestation", INVALID_ATTESTATION),
      Map.entry("attestation_revoked", ATTESTATION_REVOKED),
      Map.entry("simulator_not_allowed", SIMULATOR_NOT_ALLOWED));

  private final ErrorGroup group;
  private final String description;

  ErrorKind(final ErrorGroup group, final String description) {
    this.group = group;
    this.description = description;
  }

  /**
   * Maps a server {@code error.code} string onto a kind.
   *
   * @param code the exact code string from the server, may be null
   * @return the matching kind, or empty if the code is absent or unrecognized
   */
  public static Optional<ErrorKind> fromServerCode(final String code) {
    if (code == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(SERVER_CODES.get(code));
  }

  /**
   * Group.
   *
   * @return the group this kind belongs to
   */
  public ErrorGroup group() {
    return group;
  }

  /**
   * Description.
   *
   * @return the default human-readable description
   */
  public String description() {
    return description;
  }
}
