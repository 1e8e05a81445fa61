package com.polytape.livefeed;

import com.polytape.config.FeedProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FeedProperties.class)
public class LiveFeedApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiveFeedApplication.class, args);
  }
}
