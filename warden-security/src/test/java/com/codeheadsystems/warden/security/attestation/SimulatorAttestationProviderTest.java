package com.codeheadsystems.warden.security.attestation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.warden.exceptions.ErrorKind;
import com.codeheadsystems.warden.exceptions.WardenException;
import com.codeheadsystems.warden.security.common.ByteUtils;
import com.codeheadsystems.warden.security.signing.AppIdentity;
import com.codeheadsystems.warden.security.store.AttestationKeyStore;
import com.codeheadsystems.warden.security.store.InMemorySecureStorage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type Simulator attestation provider test.
 */
class SimulatorAttestationProviderTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private AttestationKeyStore keyStore;
  private SimulatorAttestationProvider provider;

  @BeforeEach
  void setUp() {
    keyStore = new AttestationKeyStore(new InMemorySecureStorage(), "attestation.simulator.keyId");
    provider = new SimulatorAttestationProvider(keyStore, new AppIdentity("com.example.app", "TEAM"),
        MAPPER, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void ensureKeyExists_generatesSimKeyOnce() {
    String keyId = provider.ensureKeyExists();

    assertThat(keyId).startsWith("SIM-");
    assertThat(provider.ensureKeyExists()).isEqualTo(keyId);
    assertThat(provider.isSupported()).isTrue();
    assertThat(provider.mode()).isEqualTo(AttestationMode.SIMULATOR);
  }

  @Test
  void attestKey_producesMockAttestationDocument() throws Exception {
    JsonNode doc = decode(provider.attestKey("Y2hhbGxlbmdl"));

    assertThat(doc.get("keyId").asText()).isEqualTo(provider.getKeyId().orElseThrow());
    assertThat(doc.get("challenge").asText()).isEqualTo("Y2hhbGxlbmdl");
    assertThat(doc.get("environment").asText()).isEqualTo("simulator");
    assertThat(doc.get("timestamp").asText()).isEqualTo("2024-05-01T12:00:00Z");
    assertThat(doc.get("bundleId").asText()).isEqualTo("com.example.app");
    assertThat(doc.get("mockAttestation").asBoolean()).isTrue();
  }

  @Test
  void generateAssertion_embedsCounterAndBodyHash() throws Exception {
    byte[] body = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
    String keyId = provider.ensureKeyExists();

    JsonNode doc = decode(provider.generateAssertion(body, 42L));

    assertThat(doc.get("keyId").asText()).isEqualTo(keyId);
    assertThat(doc.get("counter").asLong()).isEqualTo(42L);
    assertThat(doc.get("signature").asText()).isEqualTo(Base64.getEncoder().encodeToString(
        ByteUtils.sha256(ByteUtils.concat(body, ByteUtils.bigEndian(42L)))));
    assertThat(doc.get("mockAssertion").asBoolean()).isTrue();
  }

  @Test
  void generateAssertion_noKey_throwsKeyMissing() {
    assertThatThrownBy(() -> provider.generateAssertion(new byte[0], 1L))
        .isInstanceOf(WardenException.class)
        .satisfies(e -> assertThat(((WardenException) e).kind()).isEqualTo(ErrorKind.ATTESTATION_KEY_MISSING));
  }

  @Test
  void clearAttestation_nextKeyIsNew() {
    String first = provider.ensureKeyExists();
    provider.clearAttestation();

    assertThat(provider.getKeyId()).isEmpty();
    assertThat(provider.ensureKeyExists()).isNotEqualTo(first);
  }

  private static JsonNode decode(String base64) throws Exception {
    return MAPPER.readTree(Base64.getDecoder().decode(base64));
  }
}
