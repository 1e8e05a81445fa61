package com.polytape.livefeed.ingest;

import com.polytape.domain.Trade;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Pending batch between the socket and the canonical log. Accessed from the feed loop only; the paused flag and
 * counters are readable from anywhere.
 */
public final class IngestQueue {

  private final List<Trade> pending = new ArrayList<>();
  private final Deque<Trade> paused = new ArrayDeque<>();

  private volatile boolean pausedState;
  private volatile int queuedCount;
  private volatile int pendingCount;

  public void enqueue(Trade trade) {
    if (pausedState) {
      paused.addFirst(trade);
      queuedCount = paused.size();
      return;
    }
    pending.add(trade);
    pendingCount = pending.size();
  }

  /**
   * Drains the pending batch in arrival order.
   */
  public List<Trade> flush() {
    if (pending.isEmpty()) {
      return List.of();
    }
    List<Trade> batch = List.copyOf(pending);
    pending.clear();
    pendingCount = 0;
    return batch;
  }

  public void pause() {
    pausedState = true;
  }

  /**
   * Leaves the paused state.
   *
   * @return trades that arrived while paused, newest first
   */
  public List<Trade> resume() {
    pausedState = false;
    List<Trade> queued = List.copyOf(paused);
    paused.clear();
    queuedCount = 0;
    return queued;
  }

  public boolean isPaused() {
    return pausedState;
  }

  public int queuedCount() {
    return queuedCount;
  }

  public int pendingCount() {
    return pendingCount;
  }
}
