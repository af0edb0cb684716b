package com.codeheadsystems.warden.security.attestation;

import static com.codeheadsystems.warden.security.common.ByteUtils.bigEndian;
import static com.codeheadsystems.warden.security.common.ByteUtils.concat;
import static com.codeheadsystems.warden.security.common.ByteUtils.sha256;

import com.codeheadsystems.warden.exceptions.ErrorKind;
import com.codeheadsystems.warden.exceptions.WardenException;
import com.codeheadsystems.warden.security.store.AttestationKeyStore;
import java.util.Base64;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attestation backed by a {@link PlatformAttestationService}.
 */
public class HardwareAttestationProvider implements AttestationProvider {

  private static final Logger log = LoggerFactory.getLogger(HardwareAttestationProvider.class);

  private final PlatformAttestationService platform;
  private final AttestationKeyStore keyStore;

  /**
   * Instantiates a new Hardware attestation provider.
   *
   * @param platform the platform service
   * @param keyStore where the key id is persisted
   */
  public HardwareAttestationProvider(final PlatformAttestationService platform,
                                     final AttestationKeyStore keyStore) {
    log.info("HardwareAttestationProvider()");
    this.platform = platform;
    this.keyStore = keyStore;
  }

  @Override
  public boolean isSupported() {
    return platform.isSupported();
  }

  @Override
  public Optional<String> getKeyId() {
    return keyStore.load();
  }

  @Override
  public String ensureKeyExists() {
    Optional<String> existing = keyStore.load();
    if (existing.isPresent()) {
      return existing.get();
    }
    requireSupported();
    try {
      String keyId = platform.generateKey();
      keyStore.store(keyId);
      log.debug("ensureKeyExists(): generated hardware key {}", keyId);
      return keyId;
    } catch (PlatformAttestationException e) {
      throw new WardenException(ErrorKind.ATTESTATION_FAILED, "key generation failed", e);
    }
  }

  @Override
  public String attestKey(final String challengeBase64) {
    log.debug("attestKey()");
    final byte[] challenge;
    try {
      challenge = Base64.getDecoder().decode(challengeBase64);
    } catch (IllegalArgumentException e) {
      throw new WardenException(ErrorKind.ATTESTATION_FAILED, "challenge is not valid base64", e);
    }
    requireSupported();
    String keyId = ensureKeyExists();
    try {
      byte[] attestation = platform.attestKey(keyId, sha256(challenge));
      return Base64.getEncoder().encodeToString(attestation);
    } catch (PlatformAttestationException e) {
      throw new WardenException(ErrorKind.ATTESTATION_FAILED, "key attestation failed", e);
    }
  }

  @Override
  public String generateAssertion(final byte[] body, final long counter) {
    String keyId = keyStore.load()
        .orElseThrow(() -> new WardenException(ErrorKind.ATTESTATION_KEY_MISSING));
    requireSupported();
    byte[] clientDataHash = sha256(concat(body == null ? new byte[0] : body, bigEndian(counter)));
    try {
      return Base64.getEncoder().encodeToString(platform.generateAssertion(keyId, clientDataHash));
    } catch (PlatformAttestationException e) {
      throw new WardenException(ErrorKind.ATTESTATION_FAILED, "assertion failed", e);
    }
  }

  @Override
  public void clearAttestation() {
    keyStore.clear();
  }

  @Override
  public AttestationMode mode() {
    return AttestationMode.HARDWARE;
  }

  private void requireSupported() {
    if (!platform.isSupported()) {
      throw new WardenException(ErrorKind.ATTESTATION_UNSUPPORTED);
    }
  }
}
