package com.polytape.livefeed.ingest;

import com.polytape.domain.Trade;
import com.polytape.domain.TradeSide;
import org.junit.jupiter.api.Test;

import static com.polytape.livefeed.TradeFixtures.trade;
import static org.assertj.core.api.Assertions.assertThat;

class IngestQueueTest {

  private final IngestQueue queue = new IngestQueue();

  @Test
  void flushDrainsInArrivalOrder() {
    queue.enqueue(trade("a", TradeSide.BUY, "1"));
    queue.enqueue(trade("b", TradeSide.BUY, "1"));
    assertThat(queue.pendingCount()).isEqualTo(2);

    assertThat(queue.flush()).extracting(Trade::orderHash).containsExactly("a", "b");
    assertThat(queue.flush()).isEmpty();
    assertThat(queue.pendingCount()).isZero();
  }

  @Test
  void pausedTradesAreHeldNewestFirstUntilResume() {
    queue.enqueue(trade("a", TradeSide.BUY, "1"));
    queue.pause();
    queue.enqueue(trade("b", TradeSide.BUY, "1"));
    queue.enqueue(trade("c", TradeSide.SELL, "1"));

    assertThat(queue.isPaused()).isTrue();
    assertThat(queue.queuedCount()).isEqualTo(2);
    assertThat(queue.flush()).extracting(Trade::orderHash).containsExactly("a");

    assertThat(queue.resume()).extracting(Trade::orderHash).containsExactly("c", "b");
    assertThat(queue.isPaused()).isFalse();
    assertThat(queue.queuedCount()).isZero();
    assertThat(queue.resume()).isEmpty();
  }
}
