package com.polytape.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix="feed")
public record FeedProperties(
    @Valid Dome dome,
    @Valid Connection connection,
    @Valid Health health,
    @Valid Ingest ingest,
    @Valid Whales whales,
    @Valid Metadata metadata,
    @Valid Wallets wallets,
    @Valid Signals signals,
    @Valid Aggregation aggregation,
    @Valid Snapshot snapshot
) {

  public FeedProperties {
    if (dome == null) {
      dome = new Dome(null, null, null, null, null, null);
    }
    if (connection == null) {
      connection = new Connection(null, null, null);
    }
    if (health == null) {
      health = new Health(null, null, null, null);
    }
    if (ingest == null) {
      ingest = new Ingest(null, null, null, null);
    }
    if (whales == null) {
      whales = new Whales(null, null, null);
    }
    if (metadata == null) {
      metadata = new Metadata(null, null, null, null);
    }
    if (wallets == null) {
      wallets = new Wallets(null, null, null, null);
    }
    if (signals == null) {
      signals = new Signals(null, null, null, null, null, null);
    }
    if (aggregation == null) {
      aggregation = new Aggregation(null, null, null);
    }
    if (snapshot == null) {
      snapshot = new Snapshot(null, null);
    }
  }

  public static FeedProperties defaults() {
    return new FeedProperties(null, null, null, null, null, null, null, null, null, null);
  }

  public record Dome(
      /**
       * API key for the Dome venue. Embedded in the streaming URL and sent as bearer token on REST calls.
       */
      String apiKey,
      String wsBaseUrl,
      String restBaseUrl,
      /**
       * Optional URL-issuing endpoint returning {@code {"wsUrl": "..."}}. When blank the streaming URL is
       * built from {@code wsBaseUrl} and {@code apiKey}.
       */
      String wsUrlEndpoint,
      String platform,
      @Min(1) Integer protocolVersion
  ) {
    public Dome {
      if (apiKey == null) {
        apiKey = "";
      }
      if (wsBaseUrl == null || wsBaseUrl.isBlank()) {
        wsBaseUrl = "wss://ws.domeapi.io";
      }
      if (restBaseUrl == null || restBaseUrl.isBlank()) {
        restBaseUrl = "https://api.domeapi.io/v1";
      }
      if (wsUrlEndpoint == null) {
        wsUrlEndpoint = "";
      }
      if (platform == null || platform.isBlank()) {
        platform = "polymarket";
      }
      if (protocolVersion == null) {
        protocolVersion = 1;
      }
    }
  }

  public record Connection(
      /**
       * Connect attempts that have not completed the handshake within this window fail with TIMED_OUT.
       */
      @NotNull @Min(1) Long connectTimeoutMillis,
      /**
       * Fixed delay before the single reconnect attempt that follows an abnormal close.
       */
      @NotNull @PositiveOrZero Long reconnectBackoffMillis,
      /**
       * Start the feed automatically once the application is ready.
       */
      @NotNull Boolean autoStart
  ) {
    public Connection {
      if (connectTimeoutMillis == null) {
        connectTimeoutMillis = 10_000L;
      }
      if (reconnectBackoffMillis == null) {
        reconnectBackoffMillis = 2_000L;
      }
      if (autoStart == null) {
        autoStart = true;
      }
    }
  }

  public record Health(
      @NotNull @Min(1) Long checkIntervalMillis,
      /**
       * Idle time after which the feed is reported STALE (no reconnect yet).
       */
      @NotNull @Min(1) Long staleWarnMillis,
      /**
       * Idle time after which the watchdog force-closes the socket.
       */
      @NotNull @Min(1) Long staleTimeoutMillis,
      /**
       * Unconditional reconnect period. Set to 0 to disable.
       */
      @NotNull @PositiveOrZero Long hardReconnectMillis
  ) {
    public Health {
      if (checkIntervalMillis == null) {
        checkIntervalMillis = 5_000L;
      }
      if (staleWarnMillis == null) {
        staleWarnMillis = 10_000L;
      }
      if (staleTimeoutMillis == null) {
        staleTimeoutMillis = 15_000L;
      }
      if (hardReconnectMillis == null) {
        hardReconnectMillis = 300_000L;
      }
    }
  }

  public record Ingest(
      @NotNull @Min(1) Long flushIntervalMillis,
      @NotNull @Min(1) Integer logCapacity,
      @NotNull @Min(1) Integer whaleCapacity,
      /**
       * Identities remembered to keep re-delivered trades from being counted twice in wallet profiles.
       */
      @NotNull @Min(1) Integer recentIdentityCapacity
  ) {
    public Ingest {
      if (flushIntervalMillis == null) {
        flushIntervalMillis = 50L;
      }
      if (logCapacity == null) {
        logCapacity = 200;
      }
      if (whaleCapacity == null) {
        whaleCapacity = 2_000;
      }
      if (recentIdentityCapacity == null) {
        recentIdentityCapacity = 10_000;
      }
    }
  }

  public record Whales(
      @NotNull @PositiveOrZero BigDecimal whaleThresholdUsd,
      @NotNull @PositiveOrZero BigDecimal megaThresholdUsd,
      @NotNull @Min(1) Integer alertHistory
  ) {
    public Whales {
      if (whaleThresholdUsd == null) {
        whaleThresholdUsd = BigDecimal.valueOf(1_000);
      }
      if (megaThresholdUsd == null) {
        megaThresholdUsd = BigDecimal.valueOf(10_000);
      }
      if (alertHistory == null) {
        alertHistory = 50;
      }
    }
  }

  public record Metadata(
      @NotNull Boolean enabled,
      /**
       * Metadata resolution endpoint. Receives {@code {conditionIds, eventSlugs}} and answers {@code {markets: [...]}}.
       */
      String url,
      @NotNull @Min(1) Integer batchSize,
      @NotNull @PositiveOrZero Long debounceMillis
  ) {
    public Metadata {
      if (enabled == null) {
        enabled = false;
      }
      if (url == null) {
        url = "";
      }
      if (batchSize == null) {
        batchSize = 20;
      }
      if (debounceMillis == null) {
        debounceMillis = 1_000L;
      }
    }
  }

  public record Wallets(
      @NotNull @Min(1) Integer maxHistoryPerWallet,
      @NotNull @Min(1) Long idleTtlMinutes,
      @NotNull @Min(1) Integer maxWallets,
      @NotNull @Min(1_000) Long evictionIntervalMillis
  ) {
    public Wallets {
      if (maxHistoryPerWallet == null) {
        maxHistoryPerWallet = 100;
      }
      if (idleTtlMinutes == null) {
        idleTtlMinutes = 360L;
      }
      if (maxWallets == null) {
        maxWallets = 50_000;
      }
      if (evictionIntervalMillis == null) {
        evictionIntervalMillis = 60_000L;
      }
    }
  }

  public record Signals(
      @NotNull @Min(1) Long freshWalletMaxAgeHours,
      @NotNull @PositiveOrZero BigDecimal freshWalletMinNotionalUsd,
      @NotNull @PositiveOrZero BigDecimal unusualSizingMultiplier,
      @NotNull @Min(1) Integer repeatedEntriesThreshold,
      @NotNull @Min(1) Long clusterWindowMinutes,
      @NotNull @Min(1) Integer clusterMinTrades
  ) {
    public Signals {
      if (freshWalletMaxAgeHours == null) {
        freshWalletMaxAgeHours = 24L;
      }
      if (freshWalletMinNotionalUsd == null) {
        freshWalletMinNotionalUsd = BigDecimal.valueOf(500);
      }
      if (unusualSizingMultiplier == null) {
        unusualSizingMultiplier = BigDecimal.valueOf(3);
      }
      if (repeatedEntriesThreshold == null) {
        repeatedEntriesThreshold = 3;
      }
      if (clusterWindowMinutes == null) {
        clusterWindowMinutes = 30L;
      }
      if (clusterMinTrades == null) {
        clusterMinTrades = 3;
      }
    }
  }

  public record Aggregation(
      @NotNull @Min(1) Long statsIntervalMillis,
      @NotNull @Min(1) Long rankingsIntervalMillis,
      @NotNull @Min(1) Integer topN
  ) {
    public Aggregation {
      if (statsIntervalMillis == null) {
        statsIntervalMillis = 500L;
      }
      if (rankingsIntervalMillis == null) {
        rankingsIntervalMillis = 1_000L;
      }
      if (topN == null) {
        topN = 10;
      }
    }
  }

  public record Snapshot(
      /**
       * Seed the trade log from the REST orders endpoint when the feed starts.
       */
      @NotNull Boolean enabled,
      @NotNull @Min(1) Integer limit
  ) {
    public Snapshot {
      if (enabled == null) {
        enabled = true;
      }
      if (limit == null) {
        limit = 50;
      }
      limit = Math.min(limit, 100);
    }
  }
}
