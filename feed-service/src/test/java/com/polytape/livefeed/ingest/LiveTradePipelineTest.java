package com.polytape.livefeed.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytape.config.FeedProperties;
import com.polytape.dome.DomeCodec;
import com.polytape.dome.DomeTradesSnapshotClient;
import com.polytape.domain.FilterState;
import com.polytape.domain.Trade;
import com.polytape.domain.TradeSide;
import com.polytape.domain.WhaleTier;
import com.polytape.livefeed.ManualScheduler;
import com.polytape.livefeed.MutableClock;
import com.polytape.livefeed.enrich.MetadataEnricher;
import com.polytape.livefeed.metrics.LiveFeedMetrics;
import com.polytape.livefeed.signal.SignalDetector;
import com.polytape.livefeed.stats.AggregationEngine;
import com.polytape.livefeed.view.TrackedWallets;
import com.polytape.livefeed.view.ViewMaterializer;
import com.polytape.livefeed.wallet.WalletActivityTracker;
import com.polytape.livefeed.wallet.WalletProfile;
import com.polytape.livefeed.ws.FeedConnectException;
import com.polytape.livefeed.ws.FeedConnection;
import com.polytape.livefeed.ws.FeedSession;
import com.polytape.livefeed.ws.FeedSocket;
import com.polytape.livefeed.ws.FeedSocketListener;
import com.polytape.livefeed.ws.HealthMonitor;
import com.polytape.metadata.MarketMetadata;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.polytape.livefeed.TradeFixtures.T0;
import static com.polytape.livefeed.TradeFixtures.trade;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness=Strictness.LENIENT)
class LiveTradePipelineTest {

  @Mock
  private FeedSocket socket;

  @Mock
  private DomeTradesSnapshotClient snapshotClient;

  private final List<MarketMetadata> metadataResponse = new ArrayList<>();
  private final AtomicInteger socketsCreated = new AtomicInteger();

  private FeedProperties properties;
  private ManualScheduler loop;
  private ManualScheduler statsExecutor;
  private ManualScheduler io;
  private MutableClock clock;
  private SimpleMeterRegistry registry;
  private WalletActivityTracker walletTracker;
  private AggregationEngine aggregation;
  private FeedSocketListener socketListener;
  private LiveTradePipeline pipeline;

  @BeforeEach
  void setUp() throws Exception {
    properties = new FeedProperties(null, null, null, null, null,
        new FeedProperties.Metadata(true, "http://metadata.local/resolve", 20, 1_000L),
        null, null, null, null);
    loop = new ManualScheduler();
    statsExecutor = new ManualScheduler();
    io = new ManualScheduler();
    clock = new MutableClock(Instant.ofEpochSecond(T0));
    registry = new SimpleMeterRegistry();
    LiveFeedMetrics metrics = new LiveFeedMetrics(registry);

    when(socket.connect(any(Duration.class))).thenReturn(FeedSocket.Handshake.OPEN);
    when(socket.isOpen()).thenReturn(true);
    when(snapshotClient.recentTrades(anyInt())).thenReturn(List.of());

    FeedConnection connection = new FeedConnection(() -> URI.create("wss://ws.example/key"),
        (uri, listener) -> {
          socketListener = listener;
          socketsCreated.incrementAndGet();
          return socket;
        },
        new DomeCodec(new ObjectMapper(), "polymarket", 1), loop, properties.connection(), clock, metrics);
    MetadataEnricher enricher = new MetadataEnricher(request -> List.copyOf(metadataResponse), loop, io,
        properties.metadata(), metrics);
    walletTracker = new WalletActivityTracker(properties.wallets(), clock);
    aggregation = new AggregationEngine(properties.whales(), properties.aggregation(), clock);

    pipeline = LiveTradePipeline.builder()
        .properties(properties)
        .connection(connection)
        .healthMonitor(new HealthMonitor(connection, properties.health(), clock))
        .enricher(enricher)
        .walletTracker(walletTracker)
        .aggregation(aggregation)
        .viewMaterializer(new ViewMaterializer(properties.whales(), new SignalDetector(properties.signals()),
            walletTracker))
        .trackedWallets(new TrackedWallets())
        .snapshotClient(snapshotClient)
        .metrics(metrics)
        .clock(clock)
        .loop(loop)
        .statsExecutor(statsExecutor)
        .io(io)
        .build();
  }

  @Test
  void startSchedulesTicksAndConnects() {
    pipeline.start();
    pipeline.start();

    assertThat(pipeline.isStarted()).isTrue();
    assertThat(pipeline.session().state()).isEqualTo(FeedSession.State.OPEN);
    assertThat(socketsCreated.get()).isEqualTo(1);
    assertThat(loop.pending()).hasSize(4).allMatch(ManualScheduler.Task::periodic);
    assertThat(loop.pending()).extracting(ManualScheduler.Task::millis).contains(50L, 5_000L, 300_000L, 60_000L);
    assertThat(statsExecutor.pending()).extracting(ManualScheduler.Task::millis).containsExactly(500L, 1_000L);
  }

  @Test
  void streamedTradesReachTheLogOnTheFlushTick() {
    pipeline.start();

    socketListener.onMessage("""
        {"type":"event","data":{"side":"BUY","price":0.25,"shares":100,"timestamp":1700000000,
         "order_hash":"0xabc","user":"0xAbC1","market_slug":"btc-100k","condition_id":"0xcond"}}
        """);
    assertThat(pipeline.canonicalLog()).isEmpty();

    pipeline.flushTick();

    assertThat(pipeline.canonicalLog()).singleElement()
        .satisfies(t -> {
          assertThat(t.identity()).isEqualTo("order:0xabc");
          assertThat(t.wallet()).isEqualTo("0xabc1");
        });
    assertThat(pipeline.view()).hasSize(1);
    assertThat(registry.get("livefeed.trades.flushed").counter().count()).isEqualTo(1.0);
  }

  @Test
  void whalesAreRetainedAndAlertedOncePerIdentity() {
    List<WhaleAlert> heard = new ArrayList<>();
    pipeline.addWhaleAlertListener(heard::add);

    Trade whale = trade("w1", TradeSide.BUY, "1500");
    pipeline.ingest(whale);
    pipeline.ingest(whale);
    pipeline.ingest(trade("m1", TradeSide.SELL, "12000"));
    pipeline.ingest(trade("small", TradeSide.BUY, "999.99"));
    pipeline.flushTick();

    assertThat(pipeline.whaleTrades()).extracting(Trade::orderHash).containsExactly("m1", "w1");
    assertThat(pipeline.recentAlerts()).extracting(WhaleAlert::tier).containsExactly(WhaleTier.MEGA, WhaleTier.WHALE);
    assertThat(heard).hasSize(2);
    assertThat(pipeline.canonicalLog()).hasSize(3);
    assertThat(walletTracker.profile("0xwallet")).map(WalletProfile::tradeCount).contains(3L);
  }

  @Test
  void pausedTradesAreMergedNewestFirstOnResume() {
    pipeline.ingest(trade("a", TradeSide.BUY, "10"));
    pipeline.flushTick();

    pipeline.pause();
    pipeline.ingest(trade("b", TradeSide.BUY, "10"));
    pipeline.ingest(trade("c", TradeSide.BUY, "2000"));
    pipeline.flushTick();

    assertThat(pipeline.isPaused()).isTrue();
    assertThat(pipeline.queuedCount()).isEqualTo(2);
    assertThat(pipeline.canonicalLog()).extracting(Trade::orderHash).containsExactly("a");
    assertThat(pipeline.whaleTrades()).extracting(Trade::orderHash).containsExactly("c");

    assertThat(pipeline.resume()).isEqualTo(2);

    assertThat(pipeline.canonicalLog()).extracting(Trade::orderHash).containsExactly("c", "b", "a");
    assertThat(pipeline.queuedCount()).isZero();
    assertThat(pipeline.resume()).isZero();
  }

  @Test
  void filterChangesRecomputeTheView() {
    pipeline.ingest(trade("a", TradeSide.BUY, "10"));
    pipeline.ingest(trade("b", TradeSide.SELL, "10"));
    pipeline.ingest(trade("c", "0xother", "market-b", TradeSide.BUY, "10", T0));
    pipeline.flushTick();

    List<Trade> sells = pipeline.setFilter(FilterState.none().withSide(FilterState.SideFilter.SELL));
    assertThat(sells).extracting(Trade::orderHash).containsExactly("b");

    pipeline.setFilter(FilterState.none().withTrackedOnly(true));
    assertThat(pipeline.view()).isEmpty();

    assertThat(pipeline.trackWallet("0xOTHER")).isTrue();
    assertThat(pipeline.view()).extracting(Trade::orderHash).containsExactly("c");

    assertThat(pipeline.untrackWallet("0xother")).isTrue();
    assertThat(pipeline.view()).isEmpty();
  }

  @Test
  void csvExportFollowsTheRequestedFilter() {
    pipeline.ingest(trade("a", TradeSide.BUY, "10"));
    pipeline.ingest(trade("b", TradeSide.SELL, "10"));
    pipeline.flushTick();

    String csv = pipeline.exportCsv(FilterState.none().withSide(FilterState.SideFilter.BUY));

    assertThat(csv.split("\n")).hasSize(2);
    assertThat(csv).contains(",BUY,").doesNotContain(",SELL,");
  }

  @Test
  void snapshotSeedsTheLogInResponseOrder() {
    when(snapshotClient.recentTrades(50)).thenReturn(List.of(
        trade("n2", TradeSide.BUY, "10"),
        trade("n1", TradeSide.BUY, "10")));

    pipeline.start();

    assertThat(pipeline.canonicalLog()).extracting(Trade::orderHash).containsExactly("n2", "n1");
    assertThat(registry.get("livefeed.snapshot.trades").counter().count()).isEqualTo(2.0);
  }

  @Test
  void snapshotFailureStillConnects() {
    when(snapshotClient.recentTrades(anyInt())).thenThrow(new IllegalStateException("503"));

    pipeline.start();

    assertThat(pipeline.canonicalLog()).isEmpty();
    assertThat(pipeline.session().isOpen()).isTrue();
  }

  @Test
  void resolvedImagesArePatchedIntoIngestedTrades() {
    metadataResponse.add(new MarketMetadata(null, "cond-market-a", "market-a", null, "https://img/a.png"));

    pipeline.ingest(trade("a", TradeSide.BUY, "10"));
    pipeline.flushTick();
    assertThat(pipeline.canonicalLog().get(0).hasImage()).isFalse();

    loop.runScheduled();

    assertThat(pipeline.canonicalLog().get(0).image()).isEqualTo("https://img/a.png");
    assertThat(pipeline.view().get(0).image()).isEqualTo("https://img/a.png");

    pipeline.ingest(trade("b", TradeSide.BUY, "10"));
    pipeline.flushTick();
    assertThat(pipeline.canonicalLog().get(0).image()).isEqualTo("https://img/a.png");
  }

  @Test
  void manualReconnectOpensAFreshSocket() throws Exception {
    pipeline.start();

    FeedSession session = pipeline.reconnect();

    assertThat(session.isOpen()).isTrue();
    assertThat(socketsCreated.get()).isEqualTo(2);
  }

  @Test
  void manualReconnectSurfacesConnectFailures() throws Exception {
    pipeline.start();
    when(socket.connect(any(Duration.class))).thenReturn(FeedSocket.Handshake.TIMED_OUT);

    assertThatThrownBy(pipeline::reconnect).isInstanceOf(FeedConnectException.class);
    assertThat(pipeline.session().state()).isEqualTo(FeedSession.State.FAILED);
  }

  @Test
  void aggregationTicksReadTheCanonicalLog() {
    pipeline.start();
    pipeline.ingest(trade("a", TradeSide.BUY, "30"));
    pipeline.ingest(trade("b", TradeSide.SELL, "10"));
    pipeline.flushTick();

    statsExecutor.runScheduled();

    assertThat(aggregation.stats().tradeCount()).isEqualTo(2);
    assertThat(aggregation.stats().buyPressurePct()).isEqualTo(75.0);
    assertThat(aggregation.rankings().topTraders()).hasSize(1);
  }

  @Test
  void stopCancelsTicksAndClosesTheSocket() {
    pipeline.start();

    pipeline.stop();

    assertThat(loop.pending()).isEmpty();
    assertThat(loop.isShutdown()).isTrue();
    assertThat(pipeline.isStarted()).isFalse();
    assertThat(pipeline.session().state()).isEqualTo(FeedSession.State.CLOSED);
  }
}
