package com.polytape.livefeed.ingest;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EvictingKeySetTest {

  @Test
  void forgetsOldestKeysBeyondCapacity() {
    EvictingKeySet keys = new EvictingKeySet(2);

    assertThat(keys.add("a")).isTrue();
    assertThat(keys.add("a")).isFalse();
    keys.add("b");
    keys.add("c");

    assertThat(keys.size()).isEqualTo(2);
    assertThat(keys.contains("a")).isFalse();
    assertThat(keys.contains("c")).isTrue();
  }
}
