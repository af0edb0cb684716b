package com.codeheadsystems.warden.security.attestation;

/**
 * Raised by a {@link PlatformAttestationService} when the underlying platform call fails.
 */
public class PlatformAttestationException extends Exception {

  /**
   * Instantiates a new Platform attestation exception.
   *
   * @param message the message
   */
  public PlatformAttestationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Platform attestation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public PlatformAttestationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
