package com.polytape.dome;

import com.fasterxml.jackson.databind.JsonNode;
import com.polytape.http.JsonHttpTransport;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * Asks an issuing endpoint for the streaming URL. The endpoint answers {@code {"wsUrl": "wss://..."}}.
 */
@Slf4j
@RequiredArgsConstructor
public final class HttpSubscriptionUrlProvider implements SubscriptionUrlProvider {

  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

  private final @NonNull URI endpoint;
  private final @NonNull JsonHttpTransport transport;

  @Override
  public URI subscriptionUrl() {
    HttpRequest request = HttpRequest.newBuilder(endpoint)
        .GET()
        .timeout(REQUEST_TIMEOUT)
        .header("Accept", "application/json")
        .build();
    JsonNode body = transport.sendJson(request, JsonNode.class);
    String wsUrl = body == null ? "" : body.path("wsUrl").asText("").trim();
    if (wsUrl.isEmpty()) {
      throw new IllegalStateException("Subscription URL endpoint returned no wsUrl");
    }
    log.debug("obtained subscription url from {}", endpoint.getHost());
    return URI.create(wsUrl);
  }
}
