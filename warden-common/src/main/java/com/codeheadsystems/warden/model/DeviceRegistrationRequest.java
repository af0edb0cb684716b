package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /v1/attestation/register}, the final step of device registration.
 * <p>
 * Binds the attested key to the application identity and describes the device it lives on.
 *
 * @param keyId             the attestation key identifier
 * @param attestationObject base64 attestation produced over the hashed challenge
 * @param bundleId          the application identifier
 * @param teamId            the team identifier, may be null
 * @param deviceModel       device model description
 * @param osVersion         operating system name and version
 */
public record DeviceRegistrationRequest(
    @JsonProperty("keyId") String keyId,
    @JsonProperty("attestationObject") String attestationObject,
    @JsonProperty("bundleId") String bundleId,
    @JsonProperty("teamId") String teamId,
    @JsonProperty("deviceModel") String deviceModel,
    @JsonProperty("osVersion") String osVersion) {
}
