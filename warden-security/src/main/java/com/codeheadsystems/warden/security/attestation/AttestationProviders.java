package com.codeheadsystems.warden.security.attestation;

import com.codeheadsystems.warden.security.signing.AppIdentity;
import com.codeheadsystems.warden.security.store.AttestationKeyStore;
import com.codeheadsystems.warden.security.store.SecureStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the attestation variant once, at construction time.
 */
public class AttestationProviders {

  static final String HARDWARE_KEY_ENTRY = "attestation.keyId";
  static final String SIMULATOR_KEY_ENTRY = "attestation.simulator.keyId";

  private static final Logger log = LoggerFactory.getLogger(AttestationProviders.class);

  private AttestationProviders() {
  }

  /**
   * Hardware when a platform service is given and supported, otherwise the simulator.
   *
   * @param platform     the platform service, may be null
   * @param storage      the secure storage for the key id
   * @param appIdentity  the app identity
   * @param objectMapper the object mapper
   * @return the provider
   */
  public static AttestationProvider select(final PlatformAttestationService platform,
                                           final SecureStorage storage,
                                           final AppIdentity appIdentity,
                                           final ObjectMapper objectMapper) {
    if (platform != null && platform.isSupported()) {
      log.info("select(): hardware attestation");
      return hardware(platform, storage);
    }
    log.info("select(): simulator attestation");
    return simulator(storage, appIdentity, objectMapper);
  }

  /**
   * Hardware provider.
   *
   * @param platform the platform service
   * @param storage  the storage
   * @return the provider
   */
  public static AttestationProvider hardware(final PlatformAttestationService platform,
                                             final SecureStorage storage) {
    return new HardwareAttestationProvider(platform, new AttestationKeyStore(storage, HARDWARE_KEY_ENTRY));
  }

  /**
   * Simulator provider.
   *
   * @param storage      the storage
   * @param appIdentity  the app identity
   * @param objectMapper the object mapper
   * @return the provider
   */
  public static AttestationProvider simulator(final SecureStorage storage,
                                              final AppIdentity appIdentity,
                                              final ObjectMapper objectMapper) {
    return new SimulatorAttestationProvider(new AttestationKeyStore(storage, SIMULATOR_KEY_ENTRY),
        appIdentity, objectMapper, Clock.systemUTC());
  }
}
