package com.codeheadsystems.warden.security.attestation;

import static com.codeheadsystems.warden.security.common.ByteUtils.bigEndian;
import static com.codeheadsystems.warden.security.common.ByteUtils.concat;
import static com.codeheadsystems.warden.security.common.ByteUtils.sha256;

import com.codeheadsystems.warden.exceptions.ErrorKind;
import com.codeheadsystems.warden.exceptions.WardenException;
import com.codeheadsystems.warden.security.signing.AppIdentity;
import com.codeheadsystems.warden.security.store.AttestationKeyStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attestation for development machines and CI, where no hardware key service exists.
 * <p>
 * Produces JSON documents marked {@code "environment": "simulator"} that a server in test mode
 * accepts and a production server rejects with {@code simulator_not_allowed}.
 */
public class SimulatorAttestationProvider implements AttestationProvider {

  static final String KEY_PREFIX = "SIM-";
  static final String ENVIRONMENT = "simulator";

  private static final Logger log = LoggerFactory.getLogger(SimulatorAttestationProvider.class);
  private static final Base64.Encoder B64 = Base64.getEncoder();

  private final AttestationKeyStore keyStore;
  private final AppIdentity appIdentity;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Instantiates a new Simulator attestation provider.
   *
   * @param keyStore     where the key id is persisted
   * @param appIdentity  the app identity embedded in attestations
   * @param objectMapper the object mapper
   * @param clock        the clock for timestamps
   */
  public SimulatorAttestationProvider(final AttestationKeyStore keyStore,
                                      final AppIdentity appIdentity,
                                      final ObjectMapper objectMapper,
                                      final Clock clock) {
    log.warn("SimulatorAttestationProvider() - simulated attestation is rejected by production servers");
    this.keyStore = keyStore;
    this.appIdentity = appIdentity;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public boolean isSupported() {
    return true;
  }

  @Override
  public Optional<String> getKeyId() {
    return keyStore.load();
  }

  @Override
  public String ensureKeyExists() {
    return keyStore.load().orElseGet(() -> {
      String keyId = KEY_PREFIX + UUID.randomUUID();
      keyStore.store(keyId);
      log.debug("ensureKeyExists(): generated simulator key {}", keyId);
      return keyId;
    });
  }

  @Override
  public String attestKey(final String challengeBase64) {
    log.debug("attestKey()");
    String keyId = ensureKeyExists();
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("keyId", keyId);
    document.put("challenge", challengeBase64);
    document.put("environment", ENVIRONMENT);
    document.put("timestamp", clock.instant().toString());
    document.put("bundleId", appIdentity.appId());
    document.put("mockAttestation", true);
    return encode(document, ErrorKind.ATTESTATION_FAILED);
  }

  @Override
  public String generateAssertion(final byte[] body, final long counter) {
    String keyId = keyStore.load()
        .orElseThrow(() -> new WardenException(ErrorKind.ATTESTATION_KEY_MISSING));
    byte[] clientDataHash = sha256(concat(body == null ? new byte[0] : body, bigEndian(counter)));
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("keyId", keyId);
    document.put("counter", counter);
    document.put("signature", B64.encodeToString(clientDataHash));
    document.put("environment", ENVIRONMENT);
    document.put("timestamp", clock.instant().toString());
    document.put("mockAssertion", true);
    return encode(document, ErrorKind.ATTESTATION_FAILED);
  }

  @Override
  public void clearAttestation() {
    keyStore.clear();
  }

  @Override
  public AttestationMode mode() {
    return AttestationMode.SIMULATOR;
  }

  private String encode(final Map<String, Object> document, final ErrorKind onFailure) {
    try {
      return B64.encodeToString(objectMapper.writeValueAsBytes(document));
    } catch (JsonProcessingException e) {
      throw new WardenException(onFailure, "cannot encode simulated document", e);
    }
  }
}
