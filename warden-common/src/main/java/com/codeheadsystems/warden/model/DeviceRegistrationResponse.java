package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Server's acknowledgement of a device registration.
 *
 * @param success  whether the server accepted the attestation
 * @param deviceId server-assigned device identifier
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceRegistrationResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("deviceId") String deviceId) {
}
