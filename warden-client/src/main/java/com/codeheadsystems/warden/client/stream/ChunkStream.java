package com.codeheadsystems.warden.client.stream;

import com.codeheadsystems.warden.exceptions.ErrorKind;
import com.codeheadsystems.warden.exceptions.WardenException;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A cancellable sequence of decoded chunks read from a streaming response body.
 * <p>
 * A reader task owns the body stream: it splits it into lines, decodes them and hands chunks to
 * the consumer through a bounded queue, so a slow consumer applies backpressure to the socket.
 * The sequence ends at {@code data: [DONE]} or end of input. An I/O failure while reading ends it
 * with {@link ErrorKind#STREAM_INTERRUPTED}. If the body produces nothing for longer than the idle
 * timeout the body is closed and the consumer gets {@link ErrorKind#TIMEOUT}.
 * <p>
 * {@link #close()} cancels: the body is closed, queued chunks are dropped, and from then on
 * {@link #hasNext()} returns false and no error is reported. A chunk already confirmed by
 * {@link #hasNext()} is still returned by {@link #next()}. Iterate from one thread; cancel from
 * any thread.
 *
 * @param <C> the chunk type
 */
public class ChunkStream<C> implements Iterator<C>, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ChunkStream.class);
  private static final int READ_BUFFER = 8192;
  private static final long POLL_MILLIS = 100;

  private final InputStream body;
  private final StreamingDecoder<C> decoder;
  private final BlockingQueue<Item<C>> queue;
  private final long idleTimeoutNanos;
  private volatile boolean cancelled;
  private volatile boolean stopped;
  private volatile long lastActivity;
  private volatile Future<?> reader;

  // Consumer thread only.
  private C next;
  private boolean finished;

  ChunkStream(final InputStream body,
              final StreamingDecoder<C> decoder,
              final int capacity,
              final Duration idleTimeout) {
    this.body = body;
    this.decoder = decoder;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.idleTimeoutNanos = idleTimeout.toNanos();
    this.lastActivity = System.nanoTime();
  }

  /**
   * Starts reading the body on the executor.
   *
   * @param body     the response body
   * @param decoder  the decoder
   * @param executor runs the reader task
   * @param capacity    chunks buffered ahead of the consumer
   * @param idleTimeout longest wait for the body to produce anything
   * @param <C>         the chunk type
   * @return the stream
   */
  public static <C> ChunkStream<C> open(final InputStream body,
                                        final StreamingDecoder<C> decoder,
                                        final ExecutorService executor,
                                        final int capacity,
                                        final Duration idleTimeout) {
    ChunkStream<C> stream = new ChunkStream<>(body, decoder, capacity, idleTimeout);
    stream.reader = executor.submit(stream::read);
    return stream;
  }

  // ── Consumer ──────────────────────────────────────────────────────────────

  @Override
  public boolean hasNext() {
    if (stopped) {
      finished = true;
      return false;
    }
    if (next != null) {
      return true;
    }
    if (finished) {
      return false;
    }
    try {
      Item<C> item = null;
      while (item == null) {
        if (stopped) {
          finished = true;
          return false;
        }
        item = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (item == null && System.nanoTime() - lastActivity > idleTimeoutNanos) {
          finished = true;
          log.debug("Stream idle for more than {} ms, closing", TimeUnit.NANOSECONDS.toMillis(idleTimeoutNanos));
          stop();
          throw new WardenException(ErrorKind.TIMEOUT,
              "No data received for " + TimeUnit.NANOSECONDS.toMillis(idleTimeoutNanos) + " ms");
        }
      }
      if (stopped) {
        finished = true;
        return false;
      }
      if (item.error() != null) {
        finished = true;
        throw item.error();
      }
      if (item.chunk() == null) {
        finished = true;
        return false;
      }
      next = item.chunk();
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WardenException(ErrorKind.STREAM_INTERRUPTED, "interrupted while waiting for a chunk", e);
    }
  }

  @Override
  public C next() {
    if (next == null && !hasNext()) {
      throw new NoSuchElementException();
    }
    C chunk = next;
    next = null;
    return chunk;
  }

  /**
   * The remaining chunks as a sequential stream; closing it cancels this sequence.
   *
   * @return the stream
   */
  public Stream<C> stream() {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false)
        .onClose(this::close);
  }

  /**
   * Is cancelled.
   *
   * @return true once {@link #close()} has been called
   */
  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Same as {@link #close()}.
   */
  public void cancel() {
    close();
  }

  @Override
  public void close() {
    if (cancelled) {
      return;
    }
    cancelled = true;
    log.debug("close()");
    stop();
  }

  private void stop() {
    stopped = true;
    queue.clear();
    try {
      body.close();
    } catch (IOException e) {
      log.debug("Ignoring failure closing cancelled stream body: {}", e.getMessage());
    }
    if (reader != null) {
      reader.cancel(true);
    }
  }

  // ── Reader ────────────────────────────────────────────────────────────────

  private void read() {
    SseLineBuffer lines = new SseLineBuffer();
    byte[] buffer = new byte[READ_BUFFER];
    try (InputStream in = body) {
      int n;
      while (!stopped && (n = in.read(buffer)) != -1) {
        lastActivity = System.nanoTime();
        for (String line : lines.append(buffer, 0, n)) {
          if (stopped || !accept(line)) {
            return;
          }
        }
      }
      if (stopped) {
        return;
      }
      Optional<String> trailing = lines.finish();
      if (trailing.isPresent() && !accept(trailing.get())) {
        return;
      }
      put(new Item<>(null, null));
    } catch (IOException e) {
      if (!stopped) {
        log.debug("Stream read failed: {}", e.getMessage());
        put(new Item<>(null, new WardenException(ErrorKind.STREAM_INTERRUPTED, e.getMessage(), e)));
      }
    }
  }

  /**
   * Handles one line.
   *
   * @return false once the sequence is over
   */
  private boolean accept(final String line) {
    StreamingDecoder.Line<C> decoded = decoder.decode(line);
    switch (decoded.kind()) {
      case DONE:
        put(new Item<>(null, null));
        return false;
      case CHUNK:
        put(new Item<>(decoded.chunk().orElseThrow(), null));
        return !stopped;
      default:
        return true;
    }
  }

  private void put(final Item<C> item) {
    try {
      while (!stopped) {
        if (queue.offer(item, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
          lastActivity = System.nanoTime();
          return;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * A queued chunk, a failure, or (both null) the end of the sequence.
   */
  private record Item<C>(C chunk, WardenException error) {
  }
}
