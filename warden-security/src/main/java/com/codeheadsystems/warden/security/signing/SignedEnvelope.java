package com.codeheadsystems.warden.security.signing;

/**
 * The three values attached to a request by {@link RequestSigner#sign(byte[])}.
 *
 * @param timestamp Unix time in seconds
 * @param nonce     single-use request identifier
 * @param signature base64 HMAC-SHA256, always 44 characters
 */
public record SignedEnvelope(long timestamp, String nonce, String signature) {
}
