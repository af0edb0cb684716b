package com.codeheadsystems.warden.client.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * The type Warden client config test.
 */
class WardenClientConfigTest {

  @Test
  void production_appliesDefaults() {
    WardenClientConfig config = WardenClientConfig.production(URI.create("https://api.example.com"));

    assertThat(config.environment()).isEqualTo(ApiEnvironment.PRODUCTION);
    assertThat(config.environment().headerValue()).isEqualTo("production");
    assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.streamTimeout()).isEqualTo(Duration.ofSeconds(120));
    assertThat(config.streamBufferSize()).isEqualTo(64);
    assertThat(config.userAgent()).startsWith("warden-java/" + WardenClientConfig.VERSION + " (");
    assertThat(config.deviceMetadata()).isNotNull();
  }

  @Test
  void local_isTestEnvironmentOnLocalhost() {
    WardenClientConfig config = WardenClientConfig.local(8080);

    assertThat(config.baseUri()).isEqualTo(URI.create("http://localhost:8080"));
    assertThat(config.environment().headerValue()).isEqualTo("test");
  }

  @Test
  void withRequestTimeout_streamTimeoutFollows() {
    WardenClientConfig config = WardenClientConfig.local(8080).withRequestTimeout(Duration.ofSeconds(5));

    assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.streamTimeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(config.withStreamTimeout(Duration.ofMinutes(3)).streamTimeout()).isEqualTo(Duration.ofMinutes(3));
  }

  @Test
  void missingBaseUri_isRejected() {
    assertThatThrownBy(() -> WardenClientConfig.production(null)).isInstanceOf(NullPointerException.class);
  }
}
