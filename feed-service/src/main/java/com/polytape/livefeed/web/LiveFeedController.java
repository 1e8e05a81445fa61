package com.polytape.livefeed.web;

import com.polytape.config.FeedProperties;
import com.polytape.domain.AggregateStats;
import com.polytape.domain.FilterState;
import com.polytape.domain.MarketVolume;
import com.polytape.domain.Trade;
import com.polytape.domain.TraderStats;
import com.polytape.domain.WhaleTier;
import com.polytape.livefeed.ingest.LiveTradePipeline;
import com.polytape.livefeed.ingest.WhaleAlert;
import com.polytape.livefeed.stats.AggregationEngine;
import com.polytape.livefeed.view.TrackedWallets;
import com.polytape.livefeed.view.ViewMaterializer;
import com.polytape.livefeed.wallet.WalletActivityTracker;
import com.polytape.livefeed.wallet.WalletProfile;
import com.polytape.livefeed.ws.ConnectFailure;
import com.polytape.livefeed.ws.FeedConnectException;
import com.polytape.livefeed.ws.FeedHealth;
import com.polytape.livefeed.ws.FeedSession;
import com.polytape.livefeed.ws.HealthMonitor;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/live-trades")
@RequiredArgsConstructor
@Slf4j
public class LiveFeedController {

  private static final int MAX_LIMIT = 2_000;
  private static final int WALLET_RECENT_TRADES = 20;

  private final @NonNull FeedProperties properties;
  private final @NonNull LiveTradePipeline pipeline;
  private final @NonNull HealthMonitor healthMonitor;
  private final @NonNull AggregationEngine aggregation;
  private final @NonNull WalletActivityTracker walletTracker;
  private final @NonNull ViewMaterializer viewMaterializer;
  private final @NonNull TrackedWallets trackedWallets;
  private final @NonNull Clock clock;

  @GetMapping("/status")
  public ResponseEntity<FeedStatusResponse> status() {
    return ResponseEntity.ok(statusResponse(pipeline.session()));
  }

  @GetMapping("/trades")
  public ResponseEntity<List<TradeView>> trades(
      @RequestParam(required=false) String side,
      @RequestParam(required=false) String minVolume,
      @RequestParam(required=false) Boolean whalesOnly,
      @RequestParam(required=false) String token,
      @RequestParam(required=false) String market,
      @RequestParam(required=false) String search,
      @RequestParam(required=false) Boolean hideNoise,
      @RequestParam(required=false) Boolean trackedOnly,
      @RequestParam(required=false) Boolean signalOnly,
      @RequestParam(required=false) String signals,
      @RequestParam(required=false) Integer limit
  ) {
    FilterState filter = FilterParams.parse(side, minVolume, whalesOnly, token, market, search, hideNoise,
        trackedOnly, signalOnly, signals);
    return ResponseEntity.ok(toViews(pipeline.materialize(filter), limit));
  }

  @GetMapping("/view")
  public ResponseEntity<List<TradeView>> view(@RequestParam(required=false) Integer limit) {
    return ResponseEntity.ok(toViews(pipeline.view(), limit));
  }

  @GetMapping("/filter")
  public ResponseEntity<FilterState> filter() {
    return ResponseEntity.ok(pipeline.filter());
  }

  @PutMapping("/filter")
  public ResponseEntity<FilterState> updateFilter(@RequestBody FilterState filter) {
    pipeline.setFilter(filter);
    return ResponseEntity.ok(pipeline.filter());
  }

  @GetMapping("/whales")
  public ResponseEntity<List<TradeView>> whales(@RequestParam(required=false) Integer limit) {
    return ResponseEntity.ok(toViews(pipeline.whaleTrades(), limit));
  }

  @GetMapping("/alerts")
  public ResponseEntity<List<WhaleAlertResponse>> alerts() {
    List<WhaleAlertResponse> out = new ArrayList<>();
    for (WhaleAlert alert : pipeline.recentAlerts()) {
      out.add(new WhaleAlertResponse(alert.tier(), alert.notional(), alert.raisedAt(),
          toView(alert.trade())));
    }
    return ResponseEntity.ok(out);
  }

  @GetMapping("/stats")
  public ResponseEntity<AggregateStats> stats() {
    return ResponseEntity.ok(aggregation.stats());
  }

  @GetMapping("/top-traders")
  public ResponseEntity<List<TraderStats>> topTraders() {
    return ResponseEntity.ok(aggregation.rankings().topTraders());
  }

  @GetMapping("/markets")
  public ResponseEntity<List<MarketVolume>> markets() {
    return ResponseEntity.ok(aggregation.rankings().topMarkets());
  }

  @GetMapping("/wallets/{address}")
  public ResponseEntity<WalletProfileResponse> wallet(@PathVariable String address) {
    return walletTracker.profile(address)
        .map(profile -> ResponseEntity.ok(walletResponse(profile)))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping("/pause")
  public ResponseEntity<PauseResponse> pause() {
    pipeline.pause();
    return ResponseEntity.ok(new PauseResponse(true, pipeline.queuedCount(), 0));
  }

  @PostMapping("/resume")
  public ResponseEntity<PauseResponse> resume() {
    int merged = pipeline.resume();
    return ResponseEntity.ok(new PauseResponse(false, pipeline.queuedCount(), merged));
  }

  @PostMapping("/reconnect")
  public ResponseEntity<FeedStatusResponse> reconnect() {
    try {
      return ResponseEntity.ok(statusResponse(pipeline.reconnect()));
    } catch (FeedConnectException e) {
      log.warn("manual reconnect failed: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(statusResponse(pipeline.session()));
    }
  }

  @GetMapping("/tracked-wallets")
  public ResponseEntity<Set<String>> trackedWallets() {
    return ResponseEntity.ok(trackedWallets.snapshot());
  }

  @PostMapping("/tracked-wallets/{address}")
  public ResponseEntity<Set<String>> track(@PathVariable String address) {
    if (TrackedWallets.normalize(address) == null) {
      throw new IllegalArgumentException("wallet address is blank");
    }
    pipeline.trackWallet(address);
    return ResponseEntity.ok(trackedWallets.snapshot());
  }

  @DeleteMapping("/tracked-wallets/{address}")
  public ResponseEntity<Set<String>> untrack(@PathVariable String address) {
    if (!pipeline.untrackWallet(address)) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(trackedWallets.snapshot());
  }

  @GetMapping(value="/export.csv", produces="text/csv")
  public ResponseEntity<String> exportCsv(
      @RequestParam(required=false) String side,
      @RequestParam(required=false) String minVolume,
      @RequestParam(required=false) Boolean whalesOnly,
      @RequestParam(required=false) String token,
      @RequestParam(required=false) String market,
      @RequestParam(required=false) String search,
      @RequestParam(required=false) Boolean hideNoise,
      @RequestParam(required=false) Boolean trackedOnly,
      @RequestParam(required=false) Boolean signalOnly,
      @RequestParam(required=false) String signals
  ) {
    FilterState filter = FilterParams.parse(side, minVolume, whalesOnly, token, market, search, hideNoise,
        trackedOnly, signalOnly, signals);
    String filename = "live-trades-" + Instant.now(clock).getEpochSecond() + ".csv";
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
        .contentType(new MediaType("text", "csv"))
        .body(pipeline.exportCsv(filter));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
  }

  private FeedStatusResponse statusResponse(FeedSession session) {
    Duration age = healthMonitor.lastMessageAge();
    ConnectFailure failure = session.connectFailure();
    return new FeedStatusResponse(
        session.state().name(),
        healthMonitor.health(),
        failure == null ? null : failure.name(),
        session.subscriptionId(),
        healthMonitor.eventsPerMinute(),
        age == null ? null : age.toMillis(),
        session.reconnects(),
        pipeline.isPaused(),
        pipeline.queuedCount(),
        pipeline.canonicalLog().size(),
        pipeline.whaleTrades().size(),
        walletTracker.size(),
        trackedWallets.snapshot().size()
    );
  }

  private List<TradeView> toViews(List<Trade> trades, Integer limit) {
    int max = limit == null ? MAX_LIMIT : Math.max(0, Math.min(limit, MAX_LIMIT));
    List<TradeView> out = new ArrayList<>(Math.min(max, trades.size()));
    for (Trade trade : trades) {
      if (out.size() >= max) {
        break;
      }
      out.add(toView(trade));
    }
    return out;
  }

  private TradeView toView(Trade trade) {
    FeedProperties.Whales whales = properties.whales();
    WhaleTier tier = WhaleTier.classify(trade.notional(), whales.whaleThresholdUsd(), whales.megaThresholdUsd());
    return TradeView.of(trade, tier, viewMaterializer.signalsFor(trade));
  }

  private WalletProfileResponse walletResponse(WalletProfile profile) {
    List<Trade> history = new ArrayList<>(profile.history());
    Collections.reverse(history);
    List<TradeView> recent = toViews(history, WALLET_RECENT_TRADES);
    return new WalletProfileResponse(
        profile.wallet(),
        Instant.ofEpochSecond(profile.firstSeen()),
        Instant.ofEpochSecond(profile.lastSeen()),
        profile.totalVolume(),
        profile.tradeCount(),
        profile.averageTradeSize(),
        profile.distinctMarkets(),
        profile.marketEntries(),
        trackedWallets.isTracked(profile.wallet()),
        recent
    );
  }

  public record FeedStatusResponse(
      String state,
      FeedHealth health,
      String connectFailure,
      String subscriptionId,
      double eventsPerMinute,
      Long lastMessageAgeMillis,
      long reconnects,
      boolean paused,
      int queuedWhilePaused,
      int logSize,
      int whaleBufferSize,
      int walletsTracked,
      int trackedWallets
  ) {
  }

  public record PauseResponse(boolean paused, int queued, int merged) {
  }

  public record WhaleAlertResponse(WhaleTier tier, BigDecimal notional, Instant raisedAt, TradeView trade) {
  }

  public record WalletProfileResponse(
      String wallet,
      Instant firstSeen,
      Instant lastSeen,
      BigDecimal totalVolume,
      long tradeCount,
      BigDecimal averageTradeSize,
      int distinctMarkets,
      Map<String, Integer> marketEntries,
      boolean tracked,
      List<TradeView> recentTrades
  ) {
  }

  public record ErrorResponse(String error) {
  }
}
