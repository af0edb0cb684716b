package com.codeheadsystems.warden.security.store;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Monotonic assertion counter kept in {@link SecureStorage}.
 * <p>
 * Every increment is a read-modify-write under one lock, and the new value is persisted before it
 * is returned, so concurrent callers never observe the same value and a restart never goes
 * backwards.
 */
@Singleton
public class ReplayCounter {

  static final String COUNTER_ENTRY = "assertion_counter";

  private static final Logger log = LoggerFactory.getLogger(ReplayCounter.class);

  private final SecureStorage storage;
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Instantiates a new Replay counter.
   *
   * @param storage the storage
   */
  @Inject
  public ReplayCounter(final SecureStorage storage) {
    log.info("ReplayCounter()");
    this.storage = storage;
  }

  /**
   * Gets counter.
   *
   * @return the current value, 0 if never incremented
   */
  public long getCounter() {
    lock.lock();
    try {
      return read();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Increments the counter and persists the new value.
   *
   * @return the new value
   */
  public long incrementCounter() {
    lock.lock();
    try {
      long next = read() + 1;
      storage.write(COUNTER_ENTRY, Long.toString(next).getBytes(StandardCharsets.UTF_8));
      return next;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the stored counter; the next increment returns 1.
   */
  public void clear() {
    lock.lock();
    try {
      storage.delete(COUNTER_ENTRY);
      log.debug("clear()");
    } finally {
      lock.unlock();
    }
  }

  private long read() {
    Optional<byte[]> stored = storage.read(COUNTER_ENTRY);
    if (stored.isEmpty()) {
      return 0L;
    }
    String text = new String(stored.get(), StandardCharsets.UTF_8);
    try {
      return Math.max(0L, Long.parseLong(text.strip()));
    } catch (NumberFormatException e) {
      log.warn("Stored assertion counter is unreadable, restarting from 0");
      return 0L;
    }
  }
}
