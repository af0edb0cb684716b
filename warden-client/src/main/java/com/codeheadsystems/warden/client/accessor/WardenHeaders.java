package com.codeheadsystems.warden.client.accessor;

/**
 * Header names on the wire.
 */
public final class WardenHeaders {

  public static final String AUTHORIZATION = "Authorization";
  public static final String CONTENT_TYPE = "Content-Type";
  public static final String ACCEPT = "Accept";
  public static final String USER_AGENT = "User-Agent";
  public static final String BUNDLE_ID = "X-Bundle-Id";
  public static final String TEAM_ID = "X-Team-Id";
  public static final String ENVIRONMENT = "X-Environment";
  public static final String TIMESTAMP = "X-Timestamp";
  public static final String NONCE = "X-Nonce";
  public static final String SIGNATURE = "X-Signature";
  public static final String ATTEST_KEY_ID = "X-Attest-Key-Id";
  public static final String ATTEST_ASSERTION = "X-Attest-Assertion";
  public static final String ATTEST_COUNTER = "X-Attest-Counter";
  public static final String RETRY_AFTER = "Retry-After";

  public static final String APPLICATION_JSON = "application/json";
  public static final String EVENT_STREAM = "text/event-stream";

  private WardenHeaders() {
  }
}
