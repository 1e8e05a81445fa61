package com.polytape.livefeed.ingest;

import com.polytape.config.FeedProperties;
import com.polytape.dome.DomeTradesSnapshotClient;
import com.polytape.domain.FilterState;
import com.polytape.domain.Trade;
import com.polytape.domain.WhaleTier;
import com.polytape.livefeed.enrich.MetadataEnricher;
import com.polytape.livefeed.metrics.LiveFeedMetrics;
import com.polytape.livefeed.stats.AggregationEngine;
import com.polytape.livefeed.view.TrackedWallets;
import com.polytape.livefeed.view.TradeCsvExporter;
import com.polytape.livefeed.view.ViewMaterializer;
import com.polytape.livefeed.wallet.WalletActivityTracker;
import com.polytape.livefeed.ws.FeedConnectException;
import com.polytape.livefeed.ws.FeedConnection;
import com.polytape.livefeed.ws.FeedSession;
import com.polytape.livefeed.ws.HealthMonitor;
import jakarta.annotation.PreDestroy;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * The live trade feed: socket, ingestion, buffers, enrichment, aggregation and the materialized view.
 *
 * Every mutation of the queue, buffers, wallet profiles and metadata cache runs on the single feed loop thread.
 * Socket callbacks only decode and post. Aggregation runs on its own thread over immutable log snapshots, and
 * metadata and snapshot HTTP calls run on the I/O executor.
 */
@Slf4j
public class LiveTradePipeline {

  private static final long CONTROL_TIMEOUT_SECONDS = 15;

  private final FeedProperties properties;
  private final FeedConnection connection;
  private final HealthMonitor healthMonitor;
  private final MetadataEnricher enricher;
  private final WalletActivityTracker walletTracker;
  private final AggregationEngine aggregation;
  private final ViewMaterializer viewMaterializer;
  private final TrackedWallets trackedWallets;
  private final DomeTradesSnapshotClient snapshotClient;
  private final LiveFeedMetrics metrics;
  private final Clock clock;

  private final ScheduledExecutorService loop;
  private final ScheduledExecutorService statsExecutor;
  private final ExecutorService io;

  private final IngestQueue queue = new IngestQueue();
  private final TradeBuffer canonicalLog;
  private final TradeBuffer whaleBuffer;
  private final EvictingKeySet recordedIdentities;

  private final Deque<WhaleAlert> alerts = new ArrayDeque<>();
  private final List<WhaleAlertListener> alertListeners = new CopyOnWriteArrayList<>();
  private final List<ScheduledFuture<?>> tasks = new ArrayList<>();
  private final AtomicBoolean started = new AtomicBoolean(false);

  private volatile List<WhaleAlert> alertSnapshot = List.of();
  private volatile FilterState filter = FilterState.none();
  private volatile List<Trade> view = List.of();

  @Builder
  public LiveTradePipeline(
      @NonNull FeedProperties properties,
      @NonNull FeedConnection connection,
      @NonNull HealthMonitor healthMonitor,
      @NonNull MetadataEnricher enricher,
      @NonNull WalletActivityTracker walletTracker,
      @NonNull AggregationEngine aggregation,
      @NonNull ViewMaterializer viewMaterializer,
      @NonNull TrackedWallets trackedWallets,
      DomeTradesSnapshotClient snapshotClient,
      @NonNull LiveFeedMetrics metrics,
      @NonNull Clock clock,
      @NonNull ScheduledExecutorService loop,
      @NonNull ScheduledExecutorService statsExecutor,
      @NonNull ExecutorService io
  ) {
    this.properties = properties;
    this.connection = connection;
    this.healthMonitor = healthMonitor;
    this.enricher = enricher;
    this.walletTracker = walletTracker;
    this.aggregation = aggregation;
    this.viewMaterializer = viewMaterializer;
    this.trackedWallets = trackedWallets;
    this.snapshotClient = snapshotClient;
    this.metrics = metrics;
    this.clock = clock;
    this.loop = loop;
    this.statsExecutor = statsExecutor;
    this.io = io;

    FeedProperties.Ingest ingest = properties.ingest();
    this.canonicalLog = new TradeBuffer(ingest.logCapacity());
    this.whaleBuffer = new TradeBuffer(ingest.whaleCapacity());
    this.recordedIdentities = new EvictingKeySet(ingest.recentIdentityCapacity());

    connection.addTradeListener(trade -> loop.execute(() -> ingest(trade)));
    enricher.onResolved(this::attachResolvedImages);

    metrics.gauge("livefeed.log.size", "Trades in the canonical log", canonicalLog::size);
    metrics.gauge("livefeed.whales.size", "Trades in the whale buffer", whaleBuffer::size);
    metrics.gauge("livefeed.paused.queued", "Trades queued while paused", queue::queuedCount);
    metrics.gauge("livefeed.wallets.tracked", "Wallet profiles held", walletTracker::size);
    metrics.gauge("livefeed.metadata.cache.size", "Metadata cache entries", enricher::cacheSize);
    metrics.gauge("livefeed.throughput.epm", "Frames per minute since last open", healthMonitor::eventsPerMinute);
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onReady() {
    if (properties.connection().autoStart()) {
      start();
    } else {
      log.info("live feed auto-start disabled");
    }
  }

  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    FeedProperties.Health health = properties.health();
    FeedProperties.Aggregation agg = properties.aggregation();
    long flushMillis = properties.ingest().flushIntervalMillis();

    log.info("live feed starting (flush={}ms, log={}, whales={}, staleTimeout={}ms, hardReconnect={}ms)",
        flushMillis, canonicalLog.capacity(), whaleBuffer.capacity(),
        health.staleTimeoutMillis(), health.hardReconnectMillis());

    synchronized (tasks) {
      tasks.add(loop.scheduleAtFixedRate(() -> safeTick("flush", this::flushTick),
          flushMillis, flushMillis, TimeUnit.MILLISECONDS));
      tasks.add(loop.scheduleAtFixedRate(() -> safeTick("staleness", healthMonitor::checkStaleness),
          health.checkIntervalMillis(), health.checkIntervalMillis(), TimeUnit.MILLISECONDS));
      if (health.hardReconnectMillis() > 0) {
        tasks.add(loop.scheduleAtFixedRate(() -> safeTick("hard-reconnect", healthMonitor::hardReconnect),
            health.hardReconnectMillis(), health.hardReconnectMillis(), TimeUnit.MILLISECONDS));
      }
      long evictMillis = properties.wallets().evictionIntervalMillis();
      tasks.add(loop.scheduleAtFixedRate(() -> safeTick("wallet-eviction", walletTracker::evictIdle),
          evictMillis, evictMillis, TimeUnit.MILLISECONDS));
      tasks.add(statsExecutor.scheduleAtFixedRate(
          () -> safeTick("stats", () -> aggregation.refreshStats(canonicalLog.snapshot())),
          agg.statsIntervalMillis(), agg.statsIntervalMillis(), TimeUnit.MILLISECONDS));
      tasks.add(statsExecutor.scheduleAtFixedRate(
          () -> safeTick("rankings", () -> aggregation.refreshRankings(canonicalLog.snapshot())),
          agg.rankingsIntervalMillis(), agg.rankingsIntervalMillis(), TimeUnit.MILLISECONDS));
    }

    if (properties.snapshot().enabled() && snapshotClient != null) {
      io.execute(this::seedSnapshot);
    }
    loop.execute(this::connectQuietly);
  }

  @PreDestroy
  public void stop() {
    log.info("live feed shutting down");
    synchronized (tasks) {
      tasks.forEach(task -> task.cancel(false));
      tasks.clear();
    }
    try {
      connection.disconnect();
    } catch (Exception e) {
      log.warn("live feed disconnect failed: {}", e.toString());
    }
    loop.shutdownNow();
    statsExecutor.shutdownNow();
    io.shutdownNow();
    started.set(false);
  }

  public boolean isStarted() {
    return started.get();
  }

  /**
   * Ingestion path of one decoded trade. Feed loop only.
   */
  public void ingest(Trade incoming) {
    Trade trade = incoming;
    if (!trade.hasImage()) {
      String image = enricher.resolve(trade).orElse(null);
      if (image != null) {
        trade = trade.withImage(image);
      }
    }

    // wallet profiles and alerts see each identity once, whatever the upstream re-delivers
    if (recordedIdentities.add(trade.identity())) {
      walletTracker.record(trade);
      WhaleTier tier = WhaleTier.classify(trade.notional(),
          properties.whales().whaleThresholdUsd(), properties.whales().megaThresholdUsd());
      if (tier.isWhale()) {
        whaleBuffer.prepend(List.of(trade));
        raiseWhaleAlert(trade, tier);
      }
    }

    queue.enqueue(trade);
  }

  /**
   * Moves the pending batch into the canonical log. Feed loop only.
   */
  public void flushTick() {
    List<Trade> batch = queue.flush();
    if (batch.isEmpty()) {
      return;
    }
    long t0 = System.nanoTime();
    canonicalLog.prepend(withCachedImages(batch));
    recomputeView();
    metrics.flushed(batch.size(), System.nanoTime() - t0);
  }

  public void pause() {
    onLoop(() -> {
      queue.pause();
      log.info("live feed paused");
      return null;
    });
  }

  /**
   * @return number of trades merged from the paused queue
   */
  public int resume() {
    return onLoop(() -> {
      if (!queue.isPaused()) {
        return 0;
      }
      List<Trade> queued = queue.resume();
      canonicalLog.prepend(withCachedImages(queued));
      recomputeView();
      log.info("live feed resumed, merged {} queued trades", queued.size());
      return queued.size();
    });
  }

  public FeedSession reconnect() throws FeedConnectException {
    Callable<FeedSession> task = connection::reconnectNow;
    try {
      return loop.submit(task).get(CONTROL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof FeedConnectException fce) {
        throw fce;
      }
      throw new IllegalStateException("reconnect failed: " + e.getCause(), e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while reconnecting", e);
    } catch (TimeoutException e) {
      throw new IllegalStateException("reconnect did not complete within " + CONTROL_TIMEOUT_SECONDS + "s", e);
    }
  }

  public FilterState filter() {
    return filter;
  }

  public List<Trade> setFilter(FilterState next) {
    return onLoop(() -> {
      filter = next == null ? FilterState.none() : next;
      recomputeView();
      return view;
    });
  }

  public boolean trackWallet(String wallet) {
    boolean added = trackedWallets.track(wallet);
    if (added && filter.trackedOnly()) {
      onLoop(() -> {
        recomputeView();
        return null;
      });
    }
    return added;
  }

  public boolean untrackWallet(String wallet) {
    boolean removed = trackedWallets.untrack(wallet);
    if (removed && filter.trackedOnly()) {
      onLoop(() -> {
        recomputeView();
        return null;
      });
    }
    return removed;
  }

  public List<Trade> view() {
    return view;
  }

  /**
   * Ad-hoc view over the current snapshots. Safe from any thread.
   */
  public List<Trade> materialize(FilterState requested) {
    return viewMaterializer.materialize(canonicalLog.snapshot(), whaleBuffer.snapshot(), requested,
        trackedWallets.snapshot());
  }

  public String exportCsv(FilterState requested) {
    return TradeCsvExporter.toCsv(materialize(requested));
  }

  public List<Trade> canonicalLog() {
    return canonicalLog.snapshot();
  }

  public List<Trade> whaleTrades() {
    return whaleBuffer.snapshot();
  }

  public List<WhaleAlert> recentAlerts() {
    return alertSnapshot;
  }

  public void addWhaleAlertListener(WhaleAlertListener listener) {
    alertListeners.add(listener);
  }

  public FeedSession session() {
    return connection.session();
  }

  public boolean isPaused() {
    return queue.isPaused();
  }

  public int queuedCount() {
    return queue.queuedCount();
  }

  void seedSnapshot() {
    List<Trade> trades;
    try {
      trades = snapshotClient.recentTrades(properties.snapshot().limit());
    } catch (Exception e) {
      log.warn("live feed snapshot failed: {}", e.toString());
      return;
    }
    loop.execute(() -> seed(trades));
  }

  /**
   * Runs snapshot trades (newest first, as the venue lists them) through the normal ingestion path.
   */
  void seed(List<Trade> trades) {
    if (trades.isEmpty()) {
      return;
    }
    trades.forEach(this::ingest);
    flushTick();
    metrics.snapshotSeeded(trades.size());
    log.info("seeded live feed with {} snapshot trades", trades.size());
  }

  void attachResolvedImages() {
    Function<Trade, String> lookup = t -> enricher.cachedImage(t.marketSlug(), t.conditionId()).orElse(null);
    int patched = canonicalLog.attachImages(lookup) + whaleBuffer.attachImages(lookup);
    if (patched > 0) {
      recomputeView();
      log.debug("attached images to {} trades", patched);
    }
  }

  private List<Trade> withCachedImages(List<Trade> trades) {
    List<Trade> out = new ArrayList<>(trades.size());
    for (Trade trade : trades) {
      if (trade.hasImage()) {
        out.add(trade);
      } else {
        out.add(enricher.cachedImage(trade.marketSlug(), trade.conditionId()).map(trade::withImage).orElse(trade));
      }
    }
    return out;
  }

  private void raiseWhaleAlert(Trade trade, WhaleTier tier) {
    WhaleAlert alert = new WhaleAlert(trade, tier, trade.notional(), clock.instant());
    alerts.addFirst(alert);
    while (alerts.size() > properties.whales().alertHistory()) {
      alerts.removeLast();
    }
    alertSnapshot = List.copyOf(alerts);
    metrics.whaleAlert(tier);
    log.info("{} trade ${} on {} by {}", tier, trade.notional().toBigInteger(), trade.marketSlug(), trade.wallet());

    for (WhaleAlertListener listener : alertListeners) {
      try {
        listener.onWhaleAlert(alert);
      } catch (Exception e) {
        log.warn("whale alert listener failed: {}", e.toString());
      }
    }
  }

  private void recomputeView() {
    view = viewMaterializer.materialize(canonicalLog.snapshot(), whaleBuffer.snapshot(), filter,
        trackedWallets.snapshot());
  }

  private void connectQuietly() {
    try {
      connection.connect();
    } catch (FeedConnectException e) {
      log.debug("initial connect failed: {}", e.getFailure());
    }
  }

  private <T> T onLoop(Callable<T> task) {
    try {
      return loop.submit(task).get(CONTROL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (ExecutionException e) {
      throw new IllegalStateException("feed loop task failed: " + e.getCause(), e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted waiting for feed loop", e);
    } catch (TimeoutException e) {
      throw new IllegalStateException("feed loop busy for more than " + CONTROL_TIMEOUT_SECONDS + "s", e);
    }
  }

  private static void safeTick(String name, Runnable tick) {
    try {
      tick.run();
    } catch (Exception e) {
      log.warn("live feed {} tick failed: {}", name, e.toString());
    }
  }
}
