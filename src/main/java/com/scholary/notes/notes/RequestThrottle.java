package com.scholary.notes.notes;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Spaces out calls to a rate-limited API.
 *
 * <p>{@link #acquire()} blocks until at least the minimum interval has passed since the previous
 * acquisition, across all threads sharing the throttle.
 */
public class RequestThrottle {

  /** Sleeps for the given number of milliseconds. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final long minIntervalNanos;
  private final LongSupplier nanoClock;
  private final Sleeper sleeper;

  private long lastAcquiredNanos;
  private boolean acquiredBefore;

  public RequestThrottle(Duration minInterval) {
    this(minInterval, System::nanoTime, Thread::sleep);
  }

  RequestThrottle(Duration minInterval, LongSupplier nanoClock, Sleeper sleeper) {
    this.minIntervalNanos = minInterval.toNanos();
    this.nanoClock = nanoClock;
    this.sleeper = sleeper;
  }

  /**
   * Wait for the next slot.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public synchronized void acquire() throws InterruptedException {
    if (acquiredBefore) {
      long elapsed = nanoClock.getAsLong() - lastAcquiredNanos;
      long waitNanos = minIntervalNanos - elapsed;
      if (waitNanos > 0) {
        sleeper.sleep(Math.max(1, waitNanos / 1_000_000));
      }
    }
    lastAcquiredNanos = nanoClock.getAsLong();
    acquiredBefore = true;
  }
}
