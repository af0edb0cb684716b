package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Server's one-time challenge for device registration.
 *
 * @param challengeBase64 base64-encoded challenge bytes; the client attests over their SHA-256 hash
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChallengeResponse(@JsonProperty("challenge") String challengeBase64) {
}
