package com.codeheadsystems.warden.client.manager;

import com.codeheadsystems.warden.client.accessor.ResponseClassifier;
import com.codeheadsystems.warden.client.accessor.WardenApiAccessor;
import com.codeheadsystems.warden.client.model.ApiResponse;
import com.codeheadsystems.warden.client.stream.ChunkStream;
import com.codeheadsystems.warden.exceptions.ErrorKind;
import com.codeheadsystems.warden.exceptions.WardenException;
import com.codeheadsystems.warden.security.attestation.AttestationManager;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for API calls.
 * <p>
 * Wraps {@link WardenApiAccessor} with the two local recovery rules:
 * <ul>
 *   <li>{@code device_not_registered}: register the device, then re-issue the original request
 *   exactly once, freshly signed. A second {@code device_not_registered} is surfaced.</li>
 *   <li>{@code invalid_attestation}: drop the local key and counter, then surface the error.</li>
 * </ul>
 * Every other failure is surfaced unchanged. Returned futures fail with {@link WardenException}.
 */
@Singleton
public class WardenClientManager {

  private static final Logger log = LoggerFactory.getLogger(WardenClientManager.class);

  private final WardenApiAccessor accessor;
  private final DeviceRegistrationManager registrationManager;
  private final AttestationManager attestationManager;

  /**
   * Instantiates a new Warden client manager.
   *
   * @param accessor            the accessor
   * @param registrationManager the registration manager
   * @param attestationManager  the attestation manager, or null when attestation is not used
   */
  @Inject
  public WardenClientManager(final WardenApiAccessor accessor,
                             final DeviceRegistrationManager registrationManager,
                             final AttestationManager attestationManager) {
    log.info("WardenClientManager(attestation={})",
        attestationManager == null ? "none" : attestationManager.mode());
    this.accessor = accessor;
    this.registrationManager = registrationManager;
    this.attestationManager = attestationManager;
  }

  /**
   * Sends a request.
   *
   * @param method       the HTTP method
   * @param path         the path below the base URI
   * @param body         the request body, or null
   * @param responseType the response type, {@code Void.class} for none
   * @param <T>          the response type
   * @return the response future
   */
  public <T> CompletableFuture<ApiResponse<T>> send(final String method,
                                                    final String path,
                                                    final Object body,
                                                    final Class<T> responseType) {
    log.debug("send(method={}, path={})", method, path);
    return withRecovery(() -> accessor.send(method, path, body, responseType));
  }

  /**
   * Sends a streaming request.
   *
   * @param method    the HTTP method
   * @param path      the path below the base URI
   * @param body      the request body, or null
   * @param chunkType the chunk type
   * @param <C>       the chunk type
   * @return the chunk stream future
   */
  public <C> CompletableFuture<ChunkStream<C>> sendStreaming(final String method,
                                                             final String path,
                                                             final Object body,
                                                             final Class<C> chunkType) {
    log.debug("sendStreaming(method={}, path={})", method, path);
    return withRecovery(() -> accessor.sendStreaming(method, path, body, chunkType));
  }

  /**
   * Registration state.
   *
   * @return the device registration state
   */
  public RegistrationState registrationState() {
    return registrationManager.state();
  }

  // ── Recovery ──────────────────────────────────────────────────────────────

  private <R> CompletableFuture<R> withRecovery(final Supplier<CompletableFuture<R>> call) {
    CompletableFuture<CompletableFuture<R>> staged = call.get()
        .handle((result, error) -> error == null
            ? CompletableFuture.completedFuture(result)
            : recover(ResponseClassifier.translate(error), call));
    return staged.thenCompose(Function.identity());
  }

  private <R> CompletableFuture<R> recover(final WardenException failure,
                                           final Supplier<CompletableFuture<R>> call) {
    if (failure.kind() == ErrorKind.DEVICE_NOT_REGISTERED) {
      if (attestationManager == null) {
        return CompletableFuture.failedFuture(new WardenException(ErrorKind.ATTESTATION_UNSUPPORTED,
            "server requires a registered device but attestation is not configured"));
      }
      log.info("Device not registered, registering and retrying once");
      // Registration clears its own state on invalid_attestation; only the retry goes through surface().
      return registrationManager.register()
          .thenCompose(registration -> call.get()
              .handle((result, error) -> {
                if (error != null) {
                  throw surface(ResponseClassifier.translate(error));
                }
                return result;
              }));
    }
    return CompletableFuture.failedFuture(surface(failure));
  }

  private WardenException surface(final WardenException failure) {
    if (failure.kind() == ErrorKind.INVALID_ATTESTATION && attestationManager != null) {
      log.warn("Server rejected the device attestation, clearing local attestation state");
      attestationManager.clear();
    }
    return failure;
  }
}
