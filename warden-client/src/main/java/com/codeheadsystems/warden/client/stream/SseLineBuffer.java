package com.codeheadsystems.warden.client.stream;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Accumulates raw bytes from a response body and releases complete lines.
 * <p>
 * Lines end at {@code \n}; a {@code \r} right before it is dropped. Bytes are decoded as UTF-8
 * only once a whole line is available, so a multi-byte character split across two reads is
 * never corrupted. Not thread-safe; owned by a single reader.
 */
public class SseLineBuffer {

  private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

  /**
   * Appends bytes and returns every line they complete.
   *
   * @param bytes  the buffer
   * @param offset start offset
   * @param length number of bytes
   * @return complete lines, in order, without terminators
   */
  public List<String> append(final byte[] bytes, final int offset, final int length) {
    List<String> lines = new ArrayList<>();
    int start = offset;
    int end = offset + length;
    for (int i = offset; i < end; i++) {
      if (bytes[i] == '\n') {
        pending.write(bytes, start, i - start);
        lines.add(takeLine());
        start = i + 1;
      }
    }
    pending.write(bytes, start, end - start);
    return lines;
  }

  /**
   * Appends bytes and returns every line they complete.
   *
   * @param bytes the bytes
   * @return complete lines
   */
  public List<String> append(final byte[] bytes) {
    return append(bytes, 0, bytes.length);
  }

  /**
   * Releases whatever is left once the input has ended.
   *
   * @return the unterminated last line, if any bytes remain
   */
  public Optional<String> finish() {
    if (pending.size() == 0) {
      return Optional.empty();
    }
    return Optional.of(takeLine());
  }

  private String takeLine() {
    byte[] line = pending.toByteArray();
    pending.reset();
    int len = line.length;
    if (len > 0 && line[len - 1] == '\r') {
      len--;
    }
    return new String(line, 0, len, StandardCharsets.UTF_8);
  }
}
