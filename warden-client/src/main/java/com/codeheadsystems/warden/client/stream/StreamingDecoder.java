package com.codeheadsystems.warden.client.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies server-sent-event lines and decodes {@code data:} payloads into chunks.
 *
 * @param <C> the chunk type
 */
public class StreamingDecoder<C> {

  static final String DATA_PREFIX = "data: ";
  static final String DONE = "data: [DONE]";

  private static final Logger log = LoggerFactory.getLogger(StreamingDecoder.class);

  private final ObjectMapper objectMapper;
  private final Class<C> chunkType;

  /**
   * Instantiates a new Streaming decoder.
   *
   * @param objectMapper the object mapper
   * @param chunkType    the chunk type
   */
  public StreamingDecoder(final ObjectMapper objectMapper, final Class<C> chunkType) {
    this.objectMapper = objectMapper;
    this.chunkType = chunkType;
  }

  /**
   * Classifies one line.
   *
   * @param line the line without its terminator
   * @return what the line means
   */
  public Line<C> decode(final String line) {
    if (line.isEmpty() || line.startsWith(":")) {
      return Line.skip();
    }
    if (line.equals(DONE)) {
      return Line.done();
    }
    if (!line.startsWith(DATA_PREFIX)) {
      return Line.skip();
    }
    String payload = line.substring(DATA_PREFIX.length());
    try {
      C chunk = objectMapper.readValue(payload, chunkType);
      return chunk == null ? Line.skip() : Line.chunk(chunk);
    } catch (IOException e) {
      log.debug("Discarding undecodable chunk: {}", e.getMessage());
      return Line.skip();
    }
  }

  /**
   * Outcome of decoding one line.
   *
   * @param kind  the kind
   * @param chunk the chunk, present only for {@link Kind#CHUNK}
   * @param <C>   the chunk type
   */
  public record Line<C>(Kind kind, Optional<C> chunk) {

    static <C> Line<C> skip() {
      return new Line<>(Kind.SKIP, Optional.empty());
    }

    static <C> Line<C> done() {
      return new Line<>(Kind.DONE, Optional.empty());
    }

    static <C> Line<C> chunk(C chunk) {
      return new Line<>(Kind.CHUNK, Optional.of(chunk));
    }
  }

  /**
   * Line kinds.
   */
  public enum Kind {
    SKIP,
    DONE,
    CHUNK
  }
}
