package com.codeheadsystems.warden.client.config;

/**
 * Server environment the client talks to, sent as {@code X-Environment}.
 */
public enum ApiEnvironment {
  PRODUCTION("production"),
  TEST("test");

  private final String headerValue;

  ApiEnvironment(final String headerValue) {
    this.headerValue = headerValue;
  }

  /**
   * Header value.
   *
   * @return the wire value
   */
  public String headerValue() {
    return headerValue;
  }
}
