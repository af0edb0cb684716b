package com.codeheadsystems.warden.exceptions;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * The single exception type surfaced by the client. The {@link ErrorKind} says what went wrong;
 * the optional fields carry whatever the server or transport told us about it.
 */
public class WardenException extends RuntimeException {

  private final ErrorKind kind;
  private final Integer retryAfterSeconds;
  private final Integer statusCode;
  private final String serverCode;

  /**
   * Instantiates a new Warden exception.
   *
   * @param kind              the kind
   * @param message           the message, or null to use the kind's description
   * @param cause             the cause, may be null
   * @param retryAfterSeconds the retry-after value in seconds, may be null
   * @param statusCode        the HTTP status code, may be null
   * @param serverCode        the server's error code string, may be null
   */
  public WardenException(final ErrorKind kind,
                         final String message,
                         final Throwable cause,
                         final Integer retryAfterSeconds,
                         final Integer statusCode,
                         final String serverCode) {
    super(message == null ? kind.description() : kind.description() + ": " + message, cause);
    this.kind = kind;
    this.retryAfterSeconds = retryAfterSeconds;
    this.statusCode = statusCode;
    this.serverCode = serverCode;
  }

  /**
   * Instantiates a new Warden exception.
   *
   * @param kind    the kind
   * @param message the message
   * @param cause   the cause
   */
  public WardenException(final ErrorKind kind, final String message, final Throwable cause) {
    this(kind, message, cause, null, null, null);
  }

  /**
   * Instantiates a new Warden exception.
   *
   * @param kind    the kind
   * @param message the message
   */
  public WardenException(final ErrorKind kind, final String message) {
    this(kind, message, null, null, null, null);
  }

  /**
   * Instantiates a new Warden exception.
   *
   * @param kind the kind
   */
  public WardenException(final ErrorKind kind) {
    this(kind, null, null, null, null, null);
  }

  /**
   * Builds the exception for a non-success HTTP response.
   *
   * @param kind              the classified kind
   * @param statusCode        the HTTP status
   * @param message           the server's message, may be null
   * @param serverCode        the server's error code, may be null
   * @param retryAfterSeconds the parsed Retry-After header, may be null
   * @return the exception
   */
  public static WardenException fromResponse(final ErrorKind kind,
                                             final int statusCode,
                                             final String message,
                                             final String serverCode,
                                             final Integer retryAfterSeconds) {
    return new WardenException(kind, message, null, retryAfterSeconds, statusCode, serverCode);
  }

  public ErrorKind kind() {
    return kind;
  }

  public OptionalInt retryAfterSeconds() {
    return retryAfterSeconds == null ? OptionalInt.empty() : OptionalInt.of(retryAfterSeconds);
  }

  public OptionalInt statusCode() {
    return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }

  public Optional<String> serverCode() {
    return Optional.ofNullable(serverCode);
  }
}
