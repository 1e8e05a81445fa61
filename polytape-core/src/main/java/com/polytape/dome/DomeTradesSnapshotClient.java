package com.polytape.dome;

import com.fasterxml.jackson.databind.JsonNode;
import com.polytape.domain.Trade;
import com.polytape.http.HttpRequestFactory;
import com.polytape.http.JsonHttpTransport;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Fetches the most recent orders over REST. Used to seed the trade log while the stream warms up.
 */
@RequiredArgsConstructor
public final class DomeTradesSnapshotClient {

  public static final int MAX_LIMIT = 100;
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

  private final @NonNull HttpRequestFactory requests;
  private final @NonNull JsonHttpTransport transport;
  private final @NonNull DomeCodec codec;
  private final @NonNull String apiKey;
  private final @NonNull String platform;

  /**
   * Newest orders as returned by the venue, undecodable entries skipped.
   *
   * @param limit clamped to {@code [1, 100]}
   */
  public List<Trade> recentTrades(int limit) {
    if (apiKey.isBlank()) {
      throw new IllegalStateException("Dome API key not configured");
    }
    int clamped = Math.max(1, Math.min(limit, MAX_LIMIT));
    HttpRequest request = requests.request("/" + platform + "/orders", Map.of("limit", String.valueOf(clamped)))
        .GET()
        .timeout(REQUEST_TIMEOUT)
        .header("Accept", "application/json")
        .header("Authorization", "Bearer " + apiKey)
        .build();
    JsonNode body = transport.sendJson(request, JsonNode.class);
    return codec.decodeOrders(body);
  }
}
