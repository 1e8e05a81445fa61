package com.polytape.livefeed.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytape.config.FeedProperties;
import com.polytape.dome.DomeCodec;
import com.polytape.dome.DomeTradesSnapshotClient;
import com.polytape.dome.HttpSubscriptionUrlProvider;
import com.polytape.dome.StaticSubscriptionUrlProvider;
import com.polytape.dome.SubscriptionUrlProvider;
import com.polytape.http.HttpRequestFactory;
import com.polytape.http.JsonHttpTransport;
import com.polytape.livefeed.enrich.MetadataEnricher;
import com.polytape.livefeed.ingest.LiveTradePipeline;
import com.polytape.livefeed.metrics.LiveFeedMetrics;
import com.polytape.livefeed.signal.SignalDetector;
import com.polytape.livefeed.stats.AggregationEngine;
import com.polytape.livefeed.view.TrackedWallets;
import com.polytape.livefeed.view.ViewMaterializer;
import com.polytape.livefeed.wallet.WalletActivityTracker;
import com.polytape.livefeed.ws.FeedConnection;
import com.polytape.livefeed.ws.HealthMonitor;
import com.polytape.livefeed.ws.JavaWebSocketFeedSocket;
import com.polytape.metadata.HttpMarketMetadataSource;
import com.polytape.metadata.MarketMetadataSource;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
@Slf4j
public class LiveFeedConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public HttpClient httpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public JsonHttpTransport jsonHttpTransport(HttpClient httpClient, ObjectMapper objectMapper) {
    return new JsonHttpTransport(httpClient, objectMapper);
  }

  @Bean
  public DomeCodec domeCodec(FeedProperties properties, ObjectMapper objectMapper) {
    FeedProperties.Dome dome = properties.dome();
    return new DomeCodec(objectMapper, dome.platform(), dome.protocolVersion());
  }

  @Bean
  public SubscriptionUrlProvider subscriptionUrlProvider(FeedProperties properties, JsonHttpTransport transport) {
    FeedProperties.Dome dome = properties.dome();
    if (!dome.wsUrlEndpoint().isBlank()) {
      return new HttpSubscriptionUrlProvider(URI.create(dome.wsUrlEndpoint()), transport);
    }
    return new StaticSubscriptionUrlProvider(dome.wsBaseUrl(), dome.apiKey());
  }

  @Bean
  public MarketMetadataSource marketMetadataSource(FeedProperties properties, JsonHttpTransport transport) {
    FeedProperties.Metadata metadata = properties.metadata();
    if (!metadata.enabled() || metadata.url().isBlank()) {
      log.info("market metadata lookups disabled");
      return request -> List.of();
    }
    return new HttpMarketMetadataSource(URI.create(metadata.url()), transport);
  }

  @Bean
  public LiveFeedMetrics liveFeedMetrics(MeterRegistry registry) {
    return new LiveFeedMetrics(registry);
  }

  @Bean
  public ScheduledExecutorService liveFeedLoop() {
    return Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "live-feed-loop");
      t.setDaemon(true);
      return t;
    });
  }

  @Bean
  public ScheduledExecutorService liveFeedStats() {
    return Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "live-feed-stats");
      t.setDaemon(true);
      return t;
    });
  }

  @Bean
  public ExecutorService liveFeedMetadata() {
    return Executors.newFixedThreadPool(2, r -> {
      Thread t = new Thread(r, "live-feed-metadata");
      t.setDaemon(true);
      return t;
    });
  }

  @Bean
  public FeedConnection feedConnection(
      SubscriptionUrlProvider urlProvider,
      DomeCodec codec,
      ScheduledExecutorService liveFeedLoop,
      FeedProperties properties,
      Clock clock,
      LiveFeedMetrics metrics
  ) {
    return new FeedConnection(urlProvider, JavaWebSocketFeedSocket.factory(), codec, liveFeedLoop,
        properties.connection(), clock, metrics);
  }

  @Bean
  public HealthMonitor healthMonitor(FeedConnection connection, FeedProperties properties, Clock clock) {
    return new HealthMonitor(connection, properties.health(), clock);
  }

  @Bean
  public MetadataEnricher metadataEnricher(
      MarketMetadataSource source,
      ScheduledExecutorService liveFeedLoop,
      ExecutorService liveFeedMetadata,
      FeedProperties properties,
      LiveFeedMetrics metrics
  ) {
    return new MetadataEnricher(source, liveFeedLoop, liveFeedMetadata, properties.metadata(), metrics);
  }

  @Bean
  public WalletActivityTracker walletActivityTracker(FeedProperties properties, Clock clock) {
    return new WalletActivityTracker(properties.wallets(), clock);
  }

  @Bean
  public SignalDetector signalDetector(FeedProperties properties) {
    return new SignalDetector(properties.signals());
  }

  @Bean
  public AggregationEngine aggregationEngine(FeedProperties properties, Clock clock) {
    return new AggregationEngine(properties.whales(), properties.aggregation(), clock);
  }

  @Bean
  public TrackedWallets trackedWallets() {
    return new TrackedWallets();
  }

  @Bean
  public ViewMaterializer viewMaterializer(
      FeedProperties properties,
      SignalDetector signalDetector,
      WalletActivityTracker walletActivityTracker
  ) {
    return new ViewMaterializer(properties.whales(), signalDetector, walletActivityTracker);
  }

  @Bean
  public LiveTradePipeline liveTradePipeline(
      FeedProperties properties,
      FeedConnection connection,
      HealthMonitor healthMonitor,
      MetadataEnricher enricher,
      WalletActivityTracker walletActivityTracker,
      AggregationEngine aggregationEngine,
      ViewMaterializer viewMaterializer,
      TrackedWallets trackedWallets,
      DomeCodec codec,
      JsonHttpTransport transport,
      LiveFeedMetrics metrics,
      Clock clock,
      ScheduledExecutorService liveFeedLoop,
      ScheduledExecutorService liveFeedStats,
      ExecutorService liveFeedMetadata
  ) {
    FeedProperties.Dome dome = properties.dome();
    DomeTradesSnapshotClient snapshotClient = dome.apiKey().isBlank()
        ? null
        : new DomeTradesSnapshotClient(new HttpRequestFactory(URI.create(dome.restBaseUrl())), transport, codec,
            dome.apiKey(), dome.platform());

    return LiveTradePipeline.builder()
        .properties(properties)
        .connection(connection)
        .healthMonitor(healthMonitor)
        .enricher(enricher)
        .walletTracker(walletActivityTracker)
        .aggregation(aggregationEngine)
        .viewMaterializer(viewMaterializer)
        .trackedWallets(trackedWallets)
        .snapshotClient(snapshotClient)
        .metrics(metrics)
        .clock(clock)
        .loop(liveFeedLoop)
        .statsExecutor(liveFeedStats)
        .io(liveFeedMetadata)
        .build();
  }
}
