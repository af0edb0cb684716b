package com.codeheadsystems.warden.client.config;

import com.codeheadsystems.warden.client.model.DeviceMetadata;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Client-side configuration.
 * <p>
 * Only {@code baseUri} and {@code environment} are required; the remaining components fall back to
 * defaults when null (or non-positive for {@code streamBufferSize}). The stream timeout defaults to
 * twice the request timeout since generation can take much longer than a plain call.
 *
 * @param baseUri          server base URI, paths are appended to its path
 * @param environment      the server environment
 * @param requestTimeout   timeout for ordinary requests
 * @param streamTimeout    timeout for streaming requests
 * @param streamBufferSize chunks buffered between the reader and the consumer
 * @param userAgent        the User-Agent header
 * @param deviceMetadata   device description sent at registration
 */
public record WardenClientConfig(URI baseUri,
                                 ApiEnvironment environment,
                                 Duration requestTimeout,
                                 Duration streamTimeout,
                                 int streamBufferSize,
                                 String userAgent,
                                 DeviceMetadata deviceMetadata) {

  public static final String VERSION = "1.0.0";
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
  public static final int DEFAULT_STREAM_BUFFER_SIZE = 64;

  public WardenClientConfig {
    Objects.requireNonNull(baseUri, "baseUri");
    Objects.requireNonNull(environment, "environment");
    if (requestTimeout == null) {
      requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    }
    if (streamTimeout == null) {
      streamTimeout = requestTimeout.multipliedBy(2);
    }
    if (streamBufferSize <= 0) {
      streamBufferSize = DEFAULT_STREAM_BUFFER_SIZE;
    }
    if (userAgent == null) {
      userAgent = defaultUserAgent();
    }
    if (deviceMetadata == null) {
      deviceMetadata = DeviceMetadata.current();
    }
  }

  /**
   * Production server with default settings.
   *
   * @param baseUri the base uri
   * @return the config
   */
  public static WardenClientConfig production(URI baseUri) {
    return new WardenClientConfig(baseUri, ApiEnvironment.PRODUCTION, null, null, 0, null, null);
  }

  /**
   * Test server with default settings. Test servers accept simulated attestation.
   *
   * @param baseUri the base uri
   * @return the config
   */
  public static WardenClientConfig test(URI baseUri) {
    return new WardenClientConfig(baseUri, ApiEnvironment.TEST, null, null, 0, null, null);
  }

  /**
   * A test server on localhost.
   *
   * @param port the port
   * @return the config
   */
  public static WardenClientConfig local(int port) {
    return test(URI.create("http://localhost:" + port));
  }

  /**
   * Copy with a different request timeout; the stream timeout follows unless set explicitly.
   *
   * @param timeout the request timeout
   * @return the config
   */
  public WardenClientConfig withRequestTimeout(Duration timeout) {
    return new WardenClientConfig(baseUri, environment, timeout, null, streamBufferSize, userAgent,
        deviceMetadata);
  }

  /**
   * Copy with a different stream timeout.
   *
   * @param timeout the stream timeout
   * @return the config
   */
  public WardenClientConfig withStreamTimeout(Duration timeout) {
    return new WardenClientConfig(baseUri, environment, requestTimeout, timeout, streamBufferSize,
        userAgent, deviceMetadata);
  }

  /**
   * Default user agent.
   *
   * @return {@code warden-java/{version} ({os.name})}
   */
  public static String defaultUserAgent() {
    return "warden-java/" + VERSION + " (" + System.getProperty("os.name", "unknown") + ")";
  }
}
