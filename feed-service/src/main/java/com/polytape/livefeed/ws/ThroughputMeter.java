package com.polytape.livefeed.ws;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts frames since the last reset and reports them as a per-minute rate.
 */
public final class ThroughputMeter {

  private final AtomicLong count = new AtomicLong();
  private volatile Instant resetAt;

  public ThroughputMeter(Instant now) {
    this.resetAt = now;
  }

  public void record() {
    count.incrementAndGet();
  }

  public void reset(Instant now) {
    count.set(0);
    resetAt = now;
  }

  public long count() {
    return count.get();
  }

  public double eventsPerMinute(Instant now) {
    // at least one second of elapsed time so a burst right after a reset is not blown up
    long elapsedMillis = Math.max(1_000L, now.toEpochMilli() - resetAt.toEpochMilli());
    return count.get() * 60_000.0 / elapsedMillis;
  }
}
