package com.codeheadsystems.warden.client.manager;

import com.codeheadsystems.warden.client.accessor.WardenApiAccessor;
import com.codeheadsystems.warden.client.config.WardenClientConfig;
import com.codeheadsystems.warden.security.attestation.AttestationManager;
import com.codeheadsystems.warden.security.attestation.AttestationProviders;
import com.codeheadsystems.warden.security.attestation.PlatformAttestationService;
import com.codeheadsystems.warden.security.signing.Credential;
import com.codeheadsystems.warden.security.signing.RequestSigner;
import com.codeheadsystems.warden.security.store.ReplayCounter;
import com.codeheadsystems.warden.security.store.SecureStorage;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Wires a {@link WardenClientManager} by hand, for callers without a DI container.
 */
public class WardenClients {

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private WardenClients() {
  }

  /**
   * Client with device attestation. Hardware attestation is used when the platform service is
   * present and supported, the simulator otherwise.
   *
   * @param config     the config
   * @param credential the credential
   * @param storage    secure storage for the attestation key and counter
   * @param platform   the platform attestation service, may be null
   * @return the manager
   */
  public static WardenClientManager create(final WardenClientConfig config,
                                           final Credential credential,
                                           final SecureStorage storage,
                                           final PlatformAttestationService platform) {
    ObjectMapper objectMapper = objectMapper();
    AttestationManager attestationManager = new AttestationManager(
        AttestationProviders.select(platform, storage, credential.appIdentity(), objectMapper),
        new ReplayCounter(storage));
    return wire(config, credential, objectMapper, attestationManager);
  }

  /**
   * Client without device attestation. Requests that need a registered device fail with
   * {@code ATTESTATION_UNSUPPORTED}.
   *
   * @param config     the config
   * @param credential the credential
   * @return the manager
   */
  public static WardenClientManager createWithoutAttestation(final WardenClientConfig config,
                                                             final Credential credential) {
    return wire(config, credential, objectMapper(), null);
  }

  /**
   * The object mapper used on the wire; unknown response fields are ignored.
   *
   * @return the object mapper
   */
  public static ObjectMapper objectMapper() {
    return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private static WardenClientManager wire(final WardenClientConfig config,
                                          final Credential credential,
                                          final ObjectMapper objectMapper,
                                          final AttestationManager attestationManager) {
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(CONNECT_TIMEOUT)
        .build();
    WardenApiAccessor accessor = new WardenApiAccessor(httpClient, objectMapper, config, credential,
        new RequestSigner(credential), attestationManager);
    DeviceRegistrationManager registrationManager = new DeviceRegistrationManager(accessor,
        attestationManager, credential.appIdentity(), config);
    return new WardenClientManager(accessor, registrationManager, attestationManager);
  }
}
