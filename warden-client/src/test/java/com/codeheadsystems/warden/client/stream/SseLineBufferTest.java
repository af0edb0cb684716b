package com.codeheadsystems.warden.client.stream;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

/**
 * The type Sse line buffer test.
 */
class SseLineBufferTest {

  private final SseLineBuffer buffer = new SseLineBuffer();

  @Test
  void append_splitsOnNewlineAndStripsCarriageReturn() {
    assertThat(buffer.append(bytes("data: a\r\n\r\ndata: b\n"))).containsExactly("data: a", "", "data: b");
    assertThat(buffer.finish()).isEmpty();
  }

  @Test
  void append_partialLine_isHeldUntilTerminated() {
    assertThat(buffer.append(bytes("data: {\"con"))).isEmpty();
    assertThat(buffer.append(bytes("tent\":1}\ndata"))).containsExactly("data: {\"content\":1}");
    assertThat(buffer.finish()).contains("data");
  }

  @Test
  void append_multiByteCharacterSplitAcrossReads_isDecodedIntact() {
    byte[] line = bytes("data: café ☕\n");
    int split = line.length - 3;

    assertThat(buffer.append(Arrays.copyOfRange(line, 0, split))).isEmpty();
    assertThat(buffer.append(Arrays.copyOfRange(line, split, line.length)))
        .containsExactly("data: café ☕");
  }

  @Test
  void append_respectsOffsetAndLength() {
    byte[] data = bytes("xxdata: a\nyy");

    assertThat(buffer.append(data, 2, 8)).containsExactly("data: a");
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
