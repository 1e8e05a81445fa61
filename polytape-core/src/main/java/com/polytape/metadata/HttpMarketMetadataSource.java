package com.polytape.metadata;

import com.polytape.http.JsonHttpTransport;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;

@RequiredArgsConstructor
public final class HttpMarketMetadataSource implements MarketMetadataSource {

  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

  private final @NonNull URI endpoint;
  private final @NonNull JsonHttpTransport transport;

  @Override
  public List<MarketMetadata> lookup(MetadataRequest request) {
    if (request == null || request.isEmpty()) {
      return List.of();
    }
    HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
        .timeout(REQUEST_TIMEOUT)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(transport.writeJson(request)))
        .build();
    MetadataResponse response = transport.sendJson(httpRequest, MetadataResponse.class);
    return response == null ? List.of() : response.markets();
  }
}
