package com.codeheadsystems.warden.security.signing;

import static com.codeheadsystems.warden.security.common.ByteUtils.concat;
import static com.codeheadsystems.warden.security.common.ByteUtils.sha256;
import static com.codeheadsystems.warden.security.common.ByteUtils.utf8;

import java.time.Clock;
import java.util.Base64;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signs API requests with HMAC-SHA256 so that an intercepted key cannot be replayed from a
 * different application, and a captured request cannot be replayed or altered.
 * <p>
 * The algorithm must match the server's verifier bit for bit:
 * <ol>
 *   <li>{@code signingKey = SHA256(apiKey ++ lowercase(appId))}</li>
 *   <li>{@code bodyHash = hex(SHA256(body))}, where a missing body hashes as empty</li>
 *   <li>{@code message = timestamp + "\n" + nonce + "\n" + bodyHash}</li>
 *   <li>{@code signature = base64(HMAC-SHA256(signingKey, message))}</li>
 * </ol>
 * The signer holds no mutable state and is safe for concurrent use.
 */
@Singleton
public class RequestSigner {

  private static final Logger log = LoggerFactory.getLogger(RequestSigner.class);
  private static final Base64.Encoder B64 = Base64.getEncoder();

  private final Credential credential;
  private final Clock clock;

  /**
   * Instantiates a new Request signer using the system clock.
   *
   * @param credential the credential
   */
  @Inject
  public RequestSigner(final Credential credential) {
    this(credential, Clock.systemUTC());
  }

  /**
   * Instantiates a new Request signer.
   *
   * @param credential the credential
   * @param clock      the clock used for timestamps
   */
  public RequestSigner(final Credential credential, final Clock clock) {
    log.info("RequestSigner({})", credential.appIdentity());
    this.credential = credential;
    this.clock = clock;
  }

  /**
   * Signs a request body with the current time and a fresh nonce.
   *
   * @param body the serialized body, may be null
   * @return the timestamp, nonce and signature to attach
   */
  public SignedEnvelope sign(final byte[] body) {
    final long timestamp = clock.instant().getEpochSecond();
    final String nonce = UUID.randomUUID().toString();
    return new SignedEnvelope(timestamp, nonce, computeSignature(timestamp, nonce, body));
  }

  /**
   * Computes the signature for the given inputs. Pure: equal inputs always give equal output.
   *
   * @param timestamp Unix time in seconds
   * @param nonce     the nonce
   * @param body      the serialized body, may be null
   * @return base64 HMAC-SHA256
   */
  public String computeSignature(final long timestamp, final String nonce, final byte[] body) {
    final byte[] signingKey = sha256(concat(
        utf8(credential.apiKey()),
        utf8(credential.appIdentity().normalizedAppId())));
    final String bodyHash = Hex.toHexString(sha256(body));
    final byte[] message = utf8(timestamp + "\n" + nonce + "\n" + bodyHash);

    HMac hmac = new HMac(new SHA256Digest());
    hmac.init(new KeyParameter(signingKey));
    hmac.update(message, 0, message.length);
    byte[] out = new byte[hmac.getMacSize()];
    hmac.doFinal(out, 0);
    return B64.encodeToString(out);
  }
}
