package com.codeheadsystems.warden.security.signing;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * The type Request signer test.
 */
class RequestSignerTest {

  private static final long TIMESTAMP = 1_700_000_000L;
  private static final String NONCE = "nonce-1";
  private static final byte[] BODY = "{\"model\":\"m\"}".getBytes(StandardCharsets.UTF_8);
  private static final Credential CREDENTIAL =
      new Credential("sk-test-123", new AppIdentity("com.example.app", "TEAM123"));

  private final RequestSigner signer = new RequestSigner(CREDENTIAL,
      Clock.fixed(Instant.ofEpochSecond(TIMESTAMP), ZoneOffset.UTC));

  // ── Known answers ─────────────────────────────────────────────────────────

  /**
   * Compute signature known inputs matches server vector.
   */
  @Test
  void computeSignature_knownInputs_matchesServerVector() {
    assertThat(signer.computeSignature(TIMESTAMP, NONCE, BODY))
        .isEqualTo("zQQQAwEhvhvYls4vn7HQCVj1D4HiWXO+P6BvYboZyUU=");
  }

  /**
   * Compute signature null body matches empty body vector.
   */
  @Test
  void computeSignature_nullBody_matchesEmptyBodyVector() {
    assertThat(signer.computeSignature(TIMESTAMP, NONCE, null))
        .isEqualTo("M+roTXobMpVgXp2btWlF1LwxcVebceNuS9COQ1jhU8s=")
        .isEqualTo(signer.computeSignature(TIMESTAMP, NONCE, new byte[0]));
  }

  /**
   * Compute signature is base64 of32 bytes.
   */
  @Test
  void computeSignature_isBase64Of32Bytes() {
    String signature = signer.computeSignature(TIMESTAMP, NONCE, BODY);

    assertThat(signature).hasSize(44);
    assertThat(Base64.getDecoder().decode(signature)).hasSize(32);
  }

  // ── Determinism and sensitivity ───────────────────────────────────────────

  /**
   * Compute signature same inputs same output.
   */
  @Test
  void computeSignature_sameInputs_sameOutput() {
    assertThat(signer.computeSignature(TIMESTAMP, NONCE, BODY))
        .isEqualTo(signer.computeSignature(TIMESTAMP, NONCE, BODY.clone()));
  }

  /**
   * Compute signature any single input change changes output.
   */
  @Test
  void computeSignature_anySingleInputChange_changesOutput() {
    String base = signer.computeSignature(TIMESTAMP, NONCE, BODY);
    RequestSigner otherKey = new RequestSigner(
        new Credential("sk-test-124", CREDENTIAL.appIdentity()));
    RequestSigner otherApp = new RequestSigner(
        new Credential("sk-test-123", new AppIdentity("com.example.other")));

    assertThat(signer.computeSignature(TIMESTAMP + 1, NONCE, BODY)).isNotEqualTo(base);
    assertThat(signer.computeSignature(TIMESTAMP, "nonce-2", BODY)).isNotEqualTo(base);
    assertThat(signer.computeSignature(TIMESTAMP, NONCE, "{\"model\":\"n\"}".getBytes(StandardCharsets.UTF_8)))
        .isNotEqualTo(base);
    assertThat(otherKey.computeSignature(TIMESTAMP, NONCE, BODY)).isNotEqualTo(base);
    assertThat(otherApp.computeSignature(TIMESTAMP, NONCE, BODY)).isNotEqualTo(base);
  }

  /**
   * Compute signature app id case variants produce same signature.
   */
  @Test
  void computeSignature_appIdCaseVariants_produceSameSignature() {
    String lower = signerFor("com.example.app").computeSignature(TIMESTAMP, NONCE, BODY);

    assertThat(signerFor("com.Example.App").computeSignature(TIMESTAMP, NONCE, BODY)).isEqualTo(lower);
    assertThat(signerFor("COM.EXAMPLE.APP").computeSignature(TIMESTAMP, NONCE, BODY)).isEqualTo(lower);
  }

  /**
   * Compute signature team id is not part of key.
   */
  @Test
  void computeSignature_teamIdIsNotPartOfKey() {
    RequestSigner noTeam = new RequestSigner(
        new Credential("sk-test-123", new AppIdentity("com.example.app")));

    assertThat(noTeam.computeSignature(TIMESTAMP, NONCE, BODY))
        .isEqualTo(signer.computeSignature(TIMESTAMP, NONCE, BODY));
  }

  /**
   * Compute signature empty key and identity still signs.
   */
  @Test
  void computeSignature_emptyKeyAndIdentity_stillSigns() {
    RequestSigner empty = new RequestSigner(new Credential("", new AppIdentity("")));

    assertThat(empty.computeSignature(TIMESTAMP, NONCE, BODY)).hasSize(44);
  }

  // ── sign() ────────────────────────────────────────────────────────────────

  /**
   * Sign uses clock seconds and verifiable signature.
   */
  @Test
  void sign_usesClockSecondsAndVerifiableSignature() {
    SignedEnvelope envelope = signer.sign(BODY);

    assertThat(envelope.timestamp()).isEqualTo(TIMESTAMP);
    assertThat(envelope.signature())
        .isEqualTo(signer.computeSignature(envelope.timestamp(), envelope.nonce(), BODY));
  }

  /**
   * Sign repeated calls never reuse nonce.
   */
  @Test
  void sign_repeatedCalls_neverReuseNonce() {
    Set<String> nonces = new HashSet<>();
    for (int i = 0; i < 1000; i++) {
      nonces.add(signer.sign(BODY).nonce());
    }
    assertThat(nonces).hasSize(1000);
  }

  private static RequestSigner signerFor(String appId) {
    return new RequestSigner(new Credential("sk-test-123", new AppIdentity(appId)));
  }
}
