package com.polytape.livefeed.ingest;

import com.polytape.domain.Trade;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Bounded, newest-first, identity-deduplicated trade list.
 *
 * Single writer (the feed loop). Readers get the last published immutable snapshot.
 */
public final class TradeBuffer {

  private final int capacity;
  private volatile List<Trade> snapshot = List.of();

  public TradeBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
  }

  /**
   * Puts {@code batch} ahead of the current content. The first occurrence of an identity wins and the result is
   * truncated to capacity.
   *
   * @return number of distinct batch trades kept
   */
  public int prepend(List<Trade> batch) {
    if (batch == null || batch.isEmpty()) {
      return 0;
    }
    Map<String, Trade> merged = new LinkedHashMap<>();
    for (Trade trade : batch) {
      if (merged.size() >= capacity) {
        break;
      }
      merged.putIfAbsent(trade.identity(), trade);
    }
    int kept = merged.size();
    for (Trade trade : snapshot) {
      if (merged.size() >= capacity) {
        break;
      }
      merged.putIfAbsent(trade.identity(), trade);
    }
    snapshot = List.copyOf(merged.values());
    return kept;
  }

  /**
   * Replaces trades that have no image with the image returned by {@code lookup}, when there is one.
   *
   * @return number of trades patched
   */
  public int attachImages(Function<Trade, String> lookup) {
    List<Trade> current = snapshot;
    List<Trade> patched = null;
    int count = 0;
    for (int i = 0; i < current.size(); i++) {
      Trade trade = current.get(i);
      if (trade.hasImage()) {
        continue;
      }
      String image = lookup.apply(trade);
      if (image == null) {
        continue;
      }
      if (patched == null) {
        patched = new ArrayList<>(current);
      }
      patched.set(i, trade.withImage(image));
      count++;
    }
    if (patched != null) {
      snapshot = List.copyOf(patched);
    }
    return count;
  }

  public List<Trade> snapshot() {
    return snapshot;
  }

  public int size() {
    return snapshot.size();
  }

  public int capacity() {
    return capacity;
  }
}
