package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured error body returned by the API on non-2xx responses:
 * {@code {"error": {"message": "...", "type": "...", "code": "..."}}}.
 *
 * @param error the error detail
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorResponse(@JsonProperty("error") ErrorDetail error) {

  /**
   * The error detail.
   *
   * @param message human-readable message
   * @param type    optional error category
   * @param code    optional machine-readable code
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ErrorDetail(
      @JsonProperty("message") String message,
      @JsonProperty("type") String type,
      @JsonProperty("code") String code) {
  }
}
