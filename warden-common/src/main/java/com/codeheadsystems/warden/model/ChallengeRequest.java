package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /v1/attestation/challenge}, the first step of device registration.
 *
 * @param bundleId the calling application's identifier
 */
public record ChallengeRequest(@JsonProperty("bundleId") String bundleId) {
}
