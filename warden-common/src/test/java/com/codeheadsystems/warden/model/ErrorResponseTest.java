package com.codeheadsystems.warden.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

/**
 * The type Error response test.
 */
class ErrorResponseTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void deserialize_fullError() throws Exception {
    String json = "{\"error\":{\"message\":\"Too many\",\"type\":\"throttle\",\"code\":\"rate_limit_exceeded\"}}";

    ErrorResponse response = mapper.readValue(json, ErrorResponse.class);

    assertThat(response.error().message()).isEqualTo("Too many");
    assertThat(response.error().type()).isEqualTo("throttle");
    assertThat(response.error().code()).isEqualTo("rate_limit_exceeded");
  }

  @Test
  void deserialize_codeOnly_ignoresUnknownFields() throws Exception {
    String json = "{\"error\":{\"code\":\"nonce_reused\",\"param\":\"x\"},\"requestId\":\"r-1\"}";

    ErrorResponse response = mapper.readValue(json, ErrorResponse.class);

    assertThat(response.error().code()).isEqualTo("nonce_reused");
    assertThat(response.error().message()).isNull();
  }

  @Test
  void registrationRequest_serializesWireNames() throws Exception {
    DeviceRegistrationRequest request = new DeviceRegistrationRequest(
        "key-1", "YXR0", "com.example.app", null, "Linux amd64", "Linux 6.1");

    String json = mapper.writeValueAsString(request);

    assertThat(json)
        .contains("\"keyId\":\"key-1\"")
        .contains("\"attestationObject\":\"YXR0\"")
        .contains("\"bundleId\":\"com.example.app\"")
        .contains("\"deviceModel\":\"Linux amd64\"")
        .contains("\"osVersion\":\"Linux 6.1\"");
  }
}
