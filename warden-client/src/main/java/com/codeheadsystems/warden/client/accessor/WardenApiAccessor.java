package com.codeheadsystems.warden.client.accessor;

import com.codeheadsystems.warden.client.config.WardenClientConfig;
import com.codeheadsystems.warden.client.model.ApiResponse;
import com.codeheadsystems.warden.client.model.BillingInfo;
import com.codeheadsystems.warden.client.stream.ChunkStream;
import com.codeheadsystems.warden.client.stream.StreamingDecoder;
import com.codeheadsystems.warden.exceptions.ErrorKind;
import com.codeheadsystems.warden.exceptions.WardenException;
import com.codeheadsystems.warden.security.attestation.AssertionHeaders;
import com.codeheadsystems.warden.security.attestation.AttestationManager;
import com.codeheadsystems.warden.security.signing.Credential;
import com.codeheadsystems.warden.security.signing.RequestSigner;
import com.codeheadsystems.warden.security.signing.SignedEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP transport for the API.
 * <p>
 * Builds every request the same way (body, identity headers, signature, best-effort device
 * assertion), dispatches it with {@link HttpClient#sendAsync} and classifies the response. This
 * layer never retries; {@code WardenClientManager} adds the registration retry on top.
 * <p>
 * Returned futures complete exceptionally with a {@link WardenException}, possibly wrapped in a
 * {@link java.util.concurrent.CompletionException}; use {@link ResponseClassifier#translate} to
 * unwrap.
 */
@Singleton
public class WardenApiAccessor {

  private static final Logger log = LoggerFactory.getLogger(WardenApiAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final WardenClientConfig config;
  private final Credential credential;
  private final RequestSigner signer;
  private final AttestationManager attestationManager;
  private final ResponseClassifier classifier;
  private final ExecutorService streamExecutor;

  /**
   * Instantiates a new Warden api accessor.
   *
   * @param httpClient         the http client
   * @param objectMapper       the object mapper
   * @param config             the client config
   * @param credential         the credential
   * @param signer             the request signer
   * @param attestationManager the attestation manager, or null when attestation is not used
   */
  @Inject
  public WardenApiAccessor(final HttpClient httpClient,
                           final ObjectMapper objectMapper,
                           final WardenClientConfig config,
                           final Credential credential,
                           final RequestSigner signer,
                           final AttestationManager attestationManager) {
    this(httpClient, objectMapper, config, credential, signer, attestationManager,
        Executors.newCachedThreadPool(daemonThreads()));
  }

  /**
   * Instantiates a new Warden api accessor.
   *
   * @param httpClient         the http client
   * @param objectMapper       the object mapper
   * @param config             the client config
   * @param credential         the credential
   * @param signer             the request signer
   * @param attestationManager the attestation manager, or null when attestation is not used
   * @param streamExecutor     runs stream reader tasks
   */
  public WardenApiAccessor(final HttpClient httpClient,
                           final ObjectMapper objectMapper,
                           final WardenClientConfig config,
                           final Credential credential,
                           final RequestSigner signer,
                           final AttestationManager attestationManager,
                           final ExecutorService streamExecutor) {
    log.info("WardenApiAccessor({}, {})", config.baseUri(), config.environment());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.config = config;
    this.credential = credential;
    this.signer = signer;
    this.attestationManager = attestationManager;
    this.classifier = new ResponseClassifier(objectMapper);
    this.streamExecutor = streamExecutor;
  }

  // ── Requests ──────────────────────────────────────────────────────────────

  /**
   * Sends a request and decodes the response.
   *
   * @param method       the HTTP method
   * @param path         the path below the base URI
   * @param body         the request body, serialized as JSON; null for none
   * @param responseType the response type, {@code Void.class} to skip decoding
   * @param <T>          the response type
   * @return the response future
   */
  public <T> CompletableFuture<ApiResponse<T>> send(final String method,
                                                    final String path,
                                                    final Object body,
                                                    final Class<T> responseType) {
    log.debug("send(method={}, path={})", method, path);
    final HttpRequest request;
    try {
      request = buildRequest(method, path, encode(body), false);
    } catch (WardenException e) {
      return CompletableFuture.failedFuture(e);
    }
    return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
        .handle((response, error) -> {
          if (error != null) {
            throw ResponseClassifier.translate(error);
          }
          return toApiResponse(response, responseType);
        });
  }

  /**
   * Sends a streaming request. The future completes once response headers arrive; chunks are then
   * read in the background.
   *
   * @param method    the HTTP method
   * @param path      the path below the base URI
   * @param body      the request body; null for none
   * @param chunkType the chunk type
   * @param <C>       the chunk type
   * @return the chunk stream future
   */
  public <C> CompletableFuture<ChunkStream<C>> sendStreaming(final String method,
                                                             final String path,
                                                             final Object body,
                                                             final Class<C> chunkType) {
    log.debug("sendStreaming(method={}, path={})", method, path);
    final HttpRequest request;
    try {
      request = buildRequest(method, path, encode(body), true);
    } catch (WardenException e) {
      return CompletableFuture.failedFuture(e);
    }
    return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream())
        .handle((response, error) -> {
          if (error != null) {
            throw ResponseClassifier.translate(error);
          }
          if (!ResponseClassifier.isSuccess(response.statusCode())) {
            throw classifier.classify(response.statusCode(), response.headers(), drain(response.body()));
          }
          return ChunkStream.open(response.body(), new StreamingDecoder<>(objectMapper, chunkType),
              streamExecutor, config.streamBufferSize(), config.streamTimeout());
        });
  }

  // ── Request assembly ──────────────────────────────────────────────────────

  /**
   * Builds a signed request. Header order: content type, credential and identity, user agent,
   * environment, signature, then device assertion.
   *
   * @param method    the method
   * @param path      the path
   * @param body      the serialized body, or null
   * @param streaming true for an event-stream request
   * @return the request
   */
  HttpRequest buildRequest(final String method, final String path, final byte[] body, final boolean streaming) {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(resolve(path))
        .timeout(streaming ? config.streamTimeout() : config.requestTimeout())
        .method(method, body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(body));
    if (body != null) {
      builder.header(WardenHeaders.CONTENT_TYPE, WardenHeaders.APPLICATION_JSON);
    }
    builder.header(WardenHeaders.AUTHORIZATION, "Bearer " + credential.apiKey());
    builder.header(WardenHeaders.BUNDLE_ID, credential.appIdentity().appId());
    credential.appIdentity().team().ifPresent(team -> builder.header(WardenHeaders.TEAM_ID, team));
    builder.header(WardenHeaders.USER_AGENT, config.userAgent());
    builder.header(WardenHeaders.ENVIRONMENT, config.environment().headerValue());
    if (streaming) {
      builder.header(WardenHeaders.ACCEPT, WardenHeaders.EVENT_STREAM);
    }

    SignedEnvelope envelope = signer.sign(body);
    builder.header(WardenHeaders.TIMESTAMP, Long.toString(envelope.timestamp()));
    builder.header(WardenHeaders.NONCE, envelope.nonce());
    builder.header(WardenHeaders.SIGNATURE, envelope.signature());

    if (attestationManager != null && body != null) {
      attestationManager.assertRequest(body).ifPresent(assertion -> addAssertion(builder, assertion));
    }
    return builder.build();
  }

  private static void addAssertion(final HttpRequest.Builder builder, final AssertionHeaders assertion) {
    builder.header(WardenHeaders.ATTEST_KEY_ID, assertion.keyId());
    builder.header(WardenHeaders.ATTEST_ASSERTION, assertion.assertion());
    builder.header(WardenHeaders.ATTEST_COUNTER, Long.toString(assertion.counter()));
  }

  private URI resolve(final String path) {
    URI base = config.baseUri();
    String basePath = base.getPath() == null ? "" : base.getPath();
    if (basePath.endsWith("/")) {
      basePath = basePath.substring(0, basePath.length() - 1);
    }
    return base.resolve(basePath + (path.startsWith("/") ? path : "/" + path));
  }

  byte[] encode(final Object body) {
    if (body == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new WardenException(ErrorKind.ENCODING_FAILED, body.getClass().getSimpleName(), e);
    }
  }

  // ── Response handling ─────────────────────────────────────────────────────

  private <T> ApiResponse<T> toApiResponse(final HttpResponse<String> response, final Class<T> responseType) {
    int status = response.statusCode();
    if (!ResponseClassifier.isSuccess(status)) {
      throw classifier.classify(status, response.headers(), response.body());
    }
    T data = null;
    if (responseType != Void.class) {
      try {
        data = objectMapper.readValue(response.body(), responseType);
      } catch (IOException | IllegalArgumentException e) {
        throw new WardenException(ErrorKind.DECODING_FAILED, responseType.getSimpleName(), e);
      }
    }
    return new ApiResponse<>(data, BillingInfo.from(response.headers()));
  }

  private static String drain(final InputStream body) {
    try (InputStream in = body) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.debug("Could not read error body: {}", e.getMessage());
      return "";
    }
  }

  private static ThreadFactory daemonThreads() {
    AtomicInteger count = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "warden-stream-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
