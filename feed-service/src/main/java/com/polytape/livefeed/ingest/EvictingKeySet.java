package com.polytape.livefeed.ingest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered key set that forgets its oldest keys beyond {@code capacity}.
 */
public final class EvictingKeySet {

  private final Map<String, Boolean> keys;

  public EvictingKeySet(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.keys = new LinkedHashMap<>(Math.min(capacity, 16_384), 0.75f, false) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
        return size() > capacity;
      }
    };
  }

  /**
   * @return true when the key was not present
   */
  public synchronized boolean add(String key) {
    return keys.put(key, Boolean.TRUE) == null;
  }

  public synchronized boolean contains(String key) {
    return keys.containsKey(key);
  }

  public synchronized int size() {
    return keys.size();
  }
}
