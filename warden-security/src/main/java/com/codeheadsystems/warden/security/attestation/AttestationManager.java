package com.codeheadsystems.warden.security.attestation;

import com.codeheadsystems.warden.exceptions.WardenException;
import com.codeheadsystems.warden.security.store.ReplayCounter;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the attestation provider and the replay counter and serializes every mutation of the
 * key/counter pair under one lock.
 */
@Singleton
public class AttestationManager {

  private static final Logger log = LoggerFactory.getLogger(AttestationManager.class);

  private final AttestationProvider provider;
  private final ReplayCounter counter;
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Instantiates a new Attestation manager.
   *
   * @param provider the provider
   * @param counter  the counter
   */
  @Inject
  public AttestationManager(final AttestationProvider provider, final ReplayCounter counter) {
    log.info("AttestationManager({})", provider.mode());
    this.provider = provider;
    this.counter = counter;
  }

  /**
   * Builds assertion headers for a request body, if a key is registered.
   * <p>
   * Best effort: a missing key is normal before registration and logged at debug, any other
   * failure is logged as a warning and the request goes out without assertion headers.
   *
   * @param body the serialized request body
   * @return the headers, or empty
   */
  public Optional<AssertionHeaders> assertRequest(final byte[] body) {
    lock.lock();
    try {
      Optional<String> keyId = provider.getKeyId();
      if (keyId.isEmpty()) {
        log.debug("assertRequest(): no attestation key yet");
        return Optional.empty();
      }
      long value = counter.incrementCounter();
      String assertion = provider.generateAssertion(body, value);
      return Optional.of(new AssertionHeaders(keyId.get(), assertion, value));
    } catch (WardenException e) {
      log.warn("assertRequest(): sending without assertion ({})", e.kind(), e);
      return Optional.empty();
    } catch (RuntimeException e) {
      log.warn("assertRequest(): sending without assertion, platform failure", e);
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Ensures a key and attests it against a registration challenge.
   *
   * @param challengeBase64 the server challenge
   * @return the attested key
   */
  public AttestedKey attestForRegistration(final String challengeBase64) {
    lock.lock();
    try {
      String keyId = provider.ensureKeyExists();
      String attestation = provider.attestKey(challengeBase64);
      log.debug("attestForRegistration(): attested {}", keyId);
      return new AttestedKey(keyId, attestation);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Is supported.
   *
   * @return true if the provider can attest
   */
  public boolean isSupported() {
    return provider.isSupported();
  }

  /**
   * Mode.
   *
   * @return the provider variant
   */
  public AttestationMode mode() {
    return provider.mode();
  }

  /**
   * Drops the local key reference and the counter.
   */
  public void clear() {
    lock.lock();
    try {
      provider.clearAttestation();
      counter.clear();
      log.info("clear(): local attestation state removed");
    } finally {
      lock.unlock();
    }
  }
}
