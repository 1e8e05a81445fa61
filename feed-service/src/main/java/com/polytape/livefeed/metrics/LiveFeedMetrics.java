package com.polytape.livefeed.metrics;

import com.polytape.domain.WhaleTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer meters of the live feed. Exported through the actuator Prometheus endpoint.
 */
public class LiveFeedMetrics {

  private final MeterRegistry registry;
  private final Counter framesReceived;
  private final Counter tradesDecoded;
  private final Counter tradesFlushed;
  private final Counter snapshotTrades;
  private final Timer flushTimer;

  public LiveFeedMetrics(MeterRegistry registry) {
    this.registry = registry;

    this.framesReceived = Counter.builder("livefeed.frames.received")
        .description("Frames received from the order stream")
        .register(registry);

    this.tradesDecoded = Counter.builder("livefeed.trades.decoded")
        .description("Trade events decoded from the order stream")
        .register(registry);

    this.tradesFlushed = Counter.builder("livefeed.trades.flushed")
        .description("Trades flushed into the canonical log")
        .register(registry);

    this.snapshotTrades = Counter.builder("livefeed.snapshot.trades")
        .description("Trades seeded from the REST snapshot")
        .register(registry);

    this.flushTimer = Timer.builder("livefeed.flush.duration")
        .description("Time to merge a batch into the canonical log and recompute the view")
        .register(registry);
  }

  public void frameReceived() {
    framesReceived.increment();
  }

  public void tradeDecoded() {
    tradesDecoded.increment();
  }

  public void frameDropped(String reason) {
    Counter.builder("livefeed.frames.dropped")
        .description("Frames dropped because they could not be decoded")
        .tag("reason", reason)
        .register(registry)
        .increment();
  }

  public void reconnect(String reason) {
    Counter.builder("livefeed.reconnects")
        .description("Reconnects of the order stream")
        .tag("reason", reason)
        .register(registry)
        .increment();
  }

  public void connectFailed(String failure) {
    Counter.builder("livefeed.connect.failures")
        .tag("failure", failure)
        .register(registry)
        .increment();
  }

  public void flushed(int trades, long elapsedNanos) {
    tradesFlushed.increment(trades);
    flushTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
  }

  public void whaleAlert(WhaleTier tier) {
    Counter.builder("livefeed.whale.alerts")
        .tag("tier", tier.name().toLowerCase(Locale.ROOT))
        .register(registry)
        .increment();
  }

  public void metadataBatch(String outcome, int keys) {
    Counter.builder("livefeed.metadata.keys")
        .description("Metadata keys resolved per batch outcome")
        .tag("outcome", outcome)
        .register(registry)
        .increment(keys);
  }

  public void snapshotSeeded(int trades) {
    snapshotTrades.increment(trades);
  }

  public void gauge(String name, String description, Supplier<Number> value) {
    Gauge.builder(name, value)
        .description(description)
        .register(registry);
  }
}
