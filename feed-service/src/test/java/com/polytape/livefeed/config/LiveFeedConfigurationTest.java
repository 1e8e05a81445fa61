package com.polytape.livefeed.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytape.config.FeedProperties;
import com.polytape.dome.HttpSubscriptionUrlProvider;
import com.polytape.dome.StaticSubscriptionUrlProvider;
import com.polytape.dome.SubscriptionUrlProvider;
import com.polytape.livefeed.ingest.LiveTradePipeline;
import com.polytape.livefeed.ws.FeedSession;
import com.polytape.metadata.HttpMarketMetadataSource;
import com.polytape.metadata.MarketMetadataSource;
import com.polytape.metadata.MetadataRequest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LiveFeedConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class, LiveFeedConfiguration.class)
      .withPropertyValues("feed.connection.auto-start=false");

  @Test
  void wiresThePipelineWithoutStartingIt() {
    runner.run(context -> {
      assertThat(context).hasNotFailed();
      LiveTradePipeline pipeline = context.getBean(LiveTradePipeline.class);

      assertThat(pipeline.isStarted()).isFalse();
      assertThat(pipeline.session().state()).isEqualTo(FeedSession.State.IDLE);
      assertThat(context.getBean(SubscriptionUrlProvider.class)).isInstanceOf(StaticSubscriptionUrlProvider.class);
      assertThat(context.getBean(MeterRegistry.class).find("livefeed.log.size").gauge()).isNotNull();
    });
  }

  @Test
  void usesTheUrlEndpointWhenConfigured() {
    runner.withPropertyValues("feed.dome.ws-url-endpoint=http://localhost:9000/dome/ws-url")
        .run(context -> assertThat(context.getBean(SubscriptionUrlProvider.class))
            .isInstanceOf(HttpSubscriptionUrlProvider.class));
  }

  @Test
  void metadataSourceFollowsTheEnabledFlag() {
    runner.run(context -> assertThat(context.getBean(MarketMetadataSource.class)
        .lookup(new MetadataRequest(List.of("0xcond"), List.of()))).isEmpty());

    runner.withPropertyValues("feed.metadata.enabled=true", "feed.metadata.url=http://localhost:9000/markets")
        .run(context -> assertThat(context.getBean(MarketMetadataSource.class))
            .isInstanceOf(HttpMarketMetadataSource.class));
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(FeedProperties.class)
  static class TestConfig {

    @Bean
    ObjectMapper objectMapper() {
      return new ObjectMapper();
    }

    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }
}
