package com.polytape.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class FeedPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
            "feed.dome.api-key=abc123",
            "feed.connection.connect-timeout-millis=2500",
            "feed.ingest.whale-capacity=500",
            "feed.whales.whale-threshold-usd=2500",
            "feed.metadata.enabled=true",
            "feed.metadata.url=http://localhost:9000/markets",
            "feed.signals.cluster-min-trades=5",
            "feed.snapshot.limit=250"
        )
        .run(context -> {
          FeedProperties properties = context.getBean(FeedProperties.class);

          assertThat(properties.dome().apiKey()).isEqualTo("abc123");
          assertThat(properties.dome().wsBaseUrl()).isEqualTo("wss://ws.domeapi.io");
          assertThat(properties.connection().connectTimeoutMillis()).isEqualTo(2500L);
          assertThat(properties.ingest().whaleCapacity()).isEqualTo(500);
          assertThat(properties.ingest().logCapacity()).isEqualTo(200);
          assertThat(properties.whales().whaleThresholdUsd().intValue()).isEqualTo(2500);
          assertThat(properties.metadata().enabled()).isTrue();
          assertThat(properties.metadata().url()).isEqualTo("http://localhost:9000/markets");
          assertThat(properties.signals().clusterMinTrades()).isEqualTo(5);
          assertThat(properties.snapshot().limit()).isEqualTo(100);
        });
  }

  @Test
  void fillsDefaultsWhenNothingConfigured() {
    runner.run(context -> {
      FeedProperties properties = context.getBean(FeedProperties.class);

      assertThat(properties.connection().reconnectBackoffMillis()).isEqualTo(2_000L);
      assertThat(properties.health().staleTimeoutMillis()).isEqualTo(15_000L);
      assertThat(properties.health().staleWarnMillis()).isEqualTo(10_000L);
      assertThat(properties.health().hardReconnectMillis()).isEqualTo(300_000L);
      assertThat(properties.ingest().flushIntervalMillis()).isEqualTo(50L);
      assertThat(properties.whales().megaThresholdUsd().intValue()).isEqualTo(10_000);
      assertThat(properties.metadata().batchSize()).isEqualTo(20);
      assertThat(properties.wallets().maxHistoryPerWallet()).isEqualTo(100);
      assertThat(properties.aggregation().topN()).isEqualTo(10);
    });
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(FeedProperties.class)
  static class TestConfig {
  }
}
