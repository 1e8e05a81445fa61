package com.polytape.livefeed.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytape.config.FeedProperties;
import com.polytape.dome.DomeCodec;
import com.polytape.livefeed.ManualScheduler;
import com.polytape.livefeed.MutableClock;
import com.polytape.livefeed.metrics.LiveFeedMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class HealthMonitorTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  private FakeSocketFactory sockets;
  private ManualScheduler loop;
  private MutableClock clock;
  private FeedConnection connection;
  private HealthMonitor monitor;

  @BeforeEach
  void setUp() {
    sockets = new FakeSocketFactory();
    loop = new ManualScheduler();
    clock = new MutableClock(NOW);
    FeedProperties properties = FeedProperties.defaults();
    connection = new FeedConnection(() -> URI.create("wss://ws.example/key"), sockets,
        new DomeCodec(new ObjectMapper(), "polymarket", 1), loop, properties.connection(), clock,
        new LiveFeedMetrics(new SimpleMeterRegistry()));
    monitor = new HealthMonitor(connection, properties.health(), clock);
  }

  @Test
  void offlineUntilConnected() throws Exception {
    assertThat(monitor.health()).isEqualTo(FeedHealth.OFFLINE);
    assertThat(monitor.checkStaleness()).isFalse();
    assertThat(monitor.hardReconnect()).isFalse();

    connection.connect();

    assertThat(monitor.health()).isEqualTo(FeedHealth.LIVE);
  }

  @Test
  void reportsStaleBeforeForcingReconnect() throws Exception {
    connection.connect();

    clock.advance(Duration.ofSeconds(11));
    assertThat(monitor.health()).isEqualTo(FeedHealth.STALE);
    assertThat(monitor.checkStaleness()).isFalse();
    assertThat(sockets.last().closeCodes).isEmpty();

    clock.advance(Duration.ofSeconds(5));
    assertThat(monitor.checkStaleness()).isTrue();
    assertThat(sockets.last().closeCodes).containsExactly(FeedCloseCodes.STALE);
    assertThat(connection.session().state()).isEqualTo(FeedSession.State.RECONNECTING);
    assertThat(monitor.health()).isEqualTo(FeedHealth.OFFLINE);
  }

  @Test
  void anyFrameResetsTheIdleClock() throws Exception {
    connection.connect();

    clock.advance(Duration.ofSeconds(14));
    sockets.last().receive("{\"type\":\"heartbeat\"}");
    clock.advance(Duration.ofSeconds(14));

    assertThat(monitor.checkStaleness()).isFalse();
    assertThat(monitor.lastMessageAge()).isEqualTo(Duration.ofSeconds(14));
  }

  @Test
  void hardReconnectRecyclesTheOpenSocket() throws Exception {
    connection.connect();

    assertThat(monitor.hardReconnect()).isTrue();
    assertThat(sockets.last().closeCodes).containsExactly(FeedCloseCodes.HARD_RECONNECT);

    loop.runScheduled();
    assertThat(sockets.sockets).hasSize(2);
    assertThat(monitor.health()).isEqualTo(FeedHealth.LIVE);
  }

  @Test
  void eventsPerMinuteUsesTimeSinceOpen() throws Exception {
    connection.connect();
    for (int i = 0; i < 5; i++) {
      sockets.last().receive("{\"type\":\"heartbeat\"}");
    }

    clock.advance(Duration.ofSeconds(30));

    assertThat(monitor.eventsPerMinute()).isEqualTo(10.0);
  }
}
