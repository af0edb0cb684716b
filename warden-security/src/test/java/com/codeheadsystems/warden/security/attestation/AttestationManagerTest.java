package com.codeheadsystems.warden.security.attestation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.warden.exceptions.ErrorKind;
import com.codeheadsystems.warden.exceptions.WardenException;
import com.codeheadsystems.warden.security.store.InMemorySecureStorage;
import com.codeheadsystems.warden.security.store.ReplayCounter;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Attestation manager test.
 */
@ExtendWith(MockitoExtension.class)
class AttestationManagerTest {

  private static final byte[] BODY = {1, 2, 3};

  @Mock private AttestationProvider provider;

  private ReplayCounter counter;
  private AttestationManager manager;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    when(provider.mode()).thenReturn(AttestationMode.SIMULATOR);
    counter = new ReplayCounter(new InMemorySecureStorage());
    manager = new AttestationManager(provider, counter);
  }

  /**
   * Assert request with key increments counter and returns headers.
   */
  @Test
  void assertRequest_withKey_incrementsCounterAndReturnsHeaders() {
    when(provider.getKeyId()).thenReturn(Optional.of("SIM-1"));
    when(provider.generateAssertion(BODY, 1L)).thenReturn("assert-1");
    when(provider.generateAssertion(BODY, 2L)).thenReturn("assert-2");

    assertThat(manager.assertRequest(BODY)).contains(new AssertionHeaders("SIM-1", "assert-1", 1L));
    assertThat(manager.assertRequest(BODY)).contains(new AssertionHeaders("SIM-1", "assert-2", 2L));
    assertThat(counter.getCounter()).isEqualTo(2L);
  }

  /**
   * Assert request no key is empty and counter untouched.
   */
  @Test
  void assertRequest_noKey_isEmptyAndCounterUntouched() {
    when(provider.getKeyId()).thenReturn(Optional.empty());

    assertThat(manager.assertRequest(BODY)).isEmpty();
    assertThat(counter.getCounter()).isZero();
    verify(provider, never()).generateAssertion(any(), anyLong());
  }

  /**
   * Assert request provider failure is empty.
   */
  @Test
  void assertRequest_providerFailure_isEmpty() {
    when(provider.getKeyId()).thenReturn(Optional.of("hw-key"));
    when(provider.generateAssertion(eq(BODY), anyLong()))
        .thenThrow(new WardenException(ErrorKind.ATTESTATION_FAILED));

    assertThat(manager.assertRequest(BODY)).isEmpty();
  }

  /**
   * Assert request unchecked platform failure is empty.
   */
  @Test
  void assertRequest_uncheckedPlatformFailure_isEmpty() {
    when(provider.getKeyId()).thenReturn(Optional.of("hw-key"));
    when(provider.generateAssertion(eq(BODY), anyLong()))
        .thenThrow(new IllegalStateException("secure element unavailable"));

    assertThat(manager.assertRequest(BODY)).isEmpty();

    doReturn("assert-ok").when(provider).generateAssertion(eq(BODY), anyLong());
    assertThat(manager.assertRequest(BODY)).map(AssertionHeaders::assertion).contains("assert-ok");
  }

  /**
   * Attest for registration ensures key then attests.
   */
  @Test
  void attestForRegistration_ensuresKeyThenAttests() {
    when(provider.ensureKeyExists()).thenReturn("SIM-1");
    when(provider.attestKey("challenge")).thenReturn("attestation");

    assertThat(manager.attestForRegistration("challenge"))
        .isEqualTo(new AttestedKey("SIM-1", "attestation"));
  }

  /**
   * Clear removes key and counter.
   */
  @Test
  void clear_removesKeyAndCounter() {
    counter.incrementCounter();

    manager.clear();

    verify(provider).clearAttestation();
    assertThat(counter.getCounter()).isZero();
  }
}
