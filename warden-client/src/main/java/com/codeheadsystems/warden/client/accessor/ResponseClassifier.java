package com.codeheadsystems.warden.client.accessor;

import com.codeheadsystems.warden.exceptions.ErrorKind;
import com.codeheadsystems.warden.exceptions.WardenException;
import com.codeheadsystems.warden.model.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpHeaders;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns failed responses and transport errors into {@link WardenException}s.
 * <p>
 * A structured error body ({@code {"error": {"message", "type", "code"}}}) is mapped by its
 * {@code code}; anything else falls back to the HTTP status, with the raw body as the message.
 */
public class ResponseClassifier {

  private static final Logger log = LoggerFactory.getLogger(ResponseClassifier.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Response classifier.
   *
   * @param objectMapper the object mapper
   */
  public ResponseClassifier(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Is success.
   *
   * @param status the HTTP status
   * @return true for 2xx
   */
  public static boolean isSuccess(final int status) {
    return status >= 200 && status < 300;
  }

  /**
   * Classifies a non-2xx response.
   *
   * @param status  the HTTP status
   * @param headers the response headers
   * @param body    the response body, may be null
   * @return the exception to surface
   */
  public WardenException classify(final int status, final HttpHeaders headers, final String body) {
    String message = body == null || body.isBlank() ? null : body;
    String code = null;
    ErrorResponse.ErrorDetail detail = parse(body);
    if (detail != null) {
      message = detail.message();
      code = detail.code();
    }
    ErrorKind kind = ErrorKind.fromServerCode(code).orElseGet(() -> byStatus(status));
    Integer retryAfter = kind == ErrorKind.RATE_LIMITED ? retryAfter(headers) : null;
    log.debug("classify(status={}, code={}) -> {}", status, code, kind);
    return WardenException.fromResponse(kind, status, message, code, retryAfter);
  }

  /**
   * Maps a failure from the HTTP client (or a stage after it) onto a {@link WardenException}.
   * Completion and execution wrappers are removed first.
   *
   * @param error the failure
   * @return the exception to surface
   */
  public static WardenException translate(final Throwable error) {
    Throwable cause = error;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof WardenException) {
      return (WardenException) cause;
    }
    if (cause instanceof HttpTimeoutException) {
      return new WardenException(ErrorKind.TIMEOUT, cause.getMessage(), cause);
    }
    if (cause instanceof IOException) {
      return new WardenException(ErrorKind.NETWORK_FAILURE, cause.getMessage(), cause);
    }
    return new WardenException(ErrorKind.UNKNOWN, cause.getMessage(), cause);
  }

  static ErrorKind byStatus(final int status) {
    if (status == 401) {
      return ErrorKind.INVALID_CREDENTIAL;
    }
    if (status == 429) {
      return ErrorKind.RATE_LIMITED;
    }
    if (status == 400) {
      return ErrorKind.MALFORMED_REQUEST;
    }
    if (status >= 500 && status < 600) {
      return ErrorKind.SERVER_ERROR;
    }
    return ErrorKind.HTTP_ERROR;
  }

  static Integer retryAfter(final HttpHeaders headers) {
    return headers.firstValue(WardenHeaders.RETRY_AFTER)
        .map(value -> {
          try {
            int seconds = Integer.parseInt(value.strip());
            return seconds >= 0 ? seconds : null;
          } catch (NumberFormatException e) {
            log.debug("Ignoring unparsable Retry-After: {}", value);
            return null;
          }
        })
        .orElse(null);
  }

  private ErrorResponse.ErrorDetail parse(final String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      ErrorResponse response = objectMapper.readValue(body, ErrorResponse.class);
      return response == null ? null : response.error();
    } catch (IOException e) {
      log.debug("Error body is not structured, using it as the message");
      return null;
    }
  }
}
