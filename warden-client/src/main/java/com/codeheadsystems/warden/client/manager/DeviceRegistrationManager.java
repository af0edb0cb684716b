package com.codeheadsystems.warden.client.manager;

import com.codeheadsystems.warden.client.accessor.ResponseClassifier;
import com.codeheadsystems.warden.client.accessor.WardenApiAccessor;
import com.codeheadsystems.warden.client.config.WardenClientConfig;
import com.codeheadsystems.warden.client.model.ApiResponse;
import com.codeheadsystems.warden.client.model.DeviceMetadata;
import com.codeheadsystems.warden.exceptions.ErrorKind;
import com.codeheadsystems.warden.exceptions.WardenException;
import com.codeheadsystems.warden.model.ChallengeRequest;
import com.codeheadsystems.warden.model.ChallengeResponse;
import com.codeheadsystems.warden.model.DeviceRegistrationRequest;
import com.codeheadsystems.warden.model.DeviceRegistrationResponse;
import com.codeheadsystems.warden.security.attestation.AttestationManager;
import com.codeheadsystems.warden.security.attestation.AttestedKey;
import com.codeheadsystems.warden.security.signing.AppIdentity;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers this device's attestation key with the server.
 * <p>
 * <strong>Registration:</strong>
 * <ol>
 *   <li>Request a one-time challenge for the application identifier.</li>
 *   <li>Ensure a local attestation key and attest it against the hashed challenge.</li>
 *   <li>Upload the attestation with the device description; the server answers with a device id.</li>
 * </ol>
 * Concurrent callers share the registration already in flight. An {@code invalid_attestation}
 * answer at any step drops the local key and counter so the next attempt starts from a fresh key.
 */
@Singleton
public class DeviceRegistrationManager {

  static final String CHALLENGE_PATH = "/v1/attestation/challenge";
  static final String REGISTER_PATH = "/v1/attestation/register";

  private static final Logger log = LoggerFactory.getLogger(DeviceRegistrationManager.class);

  private final WardenApiAccessor accessor;
  private final AttestationManager attestationManager;
  private final AppIdentity appIdentity;
  private final DeviceMetadata deviceMetadata;
  private final AtomicReference<RegistrationState> state =
      new AtomicReference<>(RegistrationState.UNREGISTERED);
  private final AtomicReference<CompletableFuture<DeviceRegistrationResponse>> inFlight =
      new AtomicReference<>();

  /**
   * Instantiates a new Device registration manager.
   *
   * @param accessor           the accessor
   * @param attestationManager the attestation manager, or null when attestation is not used
   * @param appIdentity        the app identity
   * @param config             the client config
   */
  @Inject
  public DeviceRegistrationManager(final WardenApiAccessor accessor,
                                   final AttestationManager attestationManager,
                                   final AppIdentity appIdentity,
                                   final WardenClientConfig config) {
    log.info("DeviceRegistrationManager()");
    this.accessor = accessor;
    this.attestationManager = attestationManager;
    this.appIdentity = appIdentity;
    this.deviceMetadata = config.deviceMetadata();
  }

  /**
   * Registers the device, or joins the registration already running.
   *
   * @return the server's answer
   */
  public CompletableFuture<DeviceRegistrationResponse> register() {
    CompletableFuture<DeviceRegistrationResponse> mine = new CompletableFuture<>();
    CompletableFuture<DeviceRegistrationResponse> existing = inFlight.compareAndExchange(null, mine);
    if (existing != null) {
      log.debug("register(): joining registration in flight");
      return existing;
    }
    runRegistration().whenComplete((response, error) -> {
      inFlight.set(null);
      if (error != null) {
        mine.completeExceptionally(ResponseClassifier.translate(error));
      } else {
        mine.complete(response);
      }
    });
    return mine;
  }

  /**
   * State.
   *
   * @return the current registration state
   */
  public RegistrationState state() {
    return state.get();
  }

  private CompletableFuture<DeviceRegistrationResponse> runRegistration() {
    if (attestationManager == null || !attestationManager.isSupported()) {
      state.set(RegistrationState.FAILED);
      return CompletableFuture.failedFuture(new WardenException(ErrorKind.ATTESTATION_UNSUPPORTED,
          "device registration requires attestation"));
    }
    log.debug("register(appId={}, mode={})", appIdentity.appId(), attestationManager.mode());
    state.set(RegistrationState.ATTESTING);

    // Step 1: one-time challenge
    return accessor.send("POST", CHALLENGE_PATH, new ChallengeRequest(appIdentity.appId()),
            ChallengeResponse.class)
        // Step 2: attest the local key against it
        .thenApply(response -> attestationManager.attestForRegistration(challenge(response)))
        // Step 3: upload
        .thenCompose(this::upload)
        .thenApply(response -> {
          DeviceRegistrationResponse registration = response.data();
          if (registration == null || !registration.success()) {
            throw new WardenException(ErrorKind.ATTESTATION_FAILED, "server did not accept the registration");
          }
          state.set(RegistrationState.REGISTERED);
          log.info("Device registered: {}", registration.deviceId());
          return registration;
        })
        .whenComplete((registration, error) -> {
          if (error != null) {
            onFailure(ResponseClassifier.translate(error));
          }
        });
  }

  private CompletableFuture<ApiResponse<DeviceRegistrationResponse>> upload(final AttestedKey attested) {
    state.set(RegistrationState.REGISTERING);
    DeviceRegistrationRequest request = new DeviceRegistrationRequest(
        attested.keyId(),
        attested.attestationObject(),
        appIdentity.appId(),
        appIdentity.team().orElse(null),
        deviceMetadata.model(),
        deviceMetadata.osVersion());
    return accessor.send("POST", REGISTER_PATH, request, DeviceRegistrationResponse.class);
  }

  private void onFailure(final WardenException failure) {
    state.set(RegistrationState.FAILED);
    log.warn("Device registration failed: {}", failure.kind());
    if (failure.kind() == ErrorKind.INVALID_ATTESTATION) {
      attestationManager.clear();
    }
  }

  private static String challenge(final ApiResponse<ChallengeResponse> response) {
    ChallengeResponse challenge = response.data();
    if (challenge == null || challenge.challengeBase64() == null || challenge.challengeBase64().isBlank()) {
      throw new WardenException(ErrorKind.DECODING_FAILED, "challenge response has no challenge");
    }
    return challenge.challengeBase64();
  }
}
