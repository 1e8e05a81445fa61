package com.polytape.dome;

import java.net.URI;

/**
 * Builds {@code {wsBaseUrl}/{apiKey}} from configuration.
 */
public final class StaticSubscriptionUrlProvider implements SubscriptionUrlProvider {

  private final String wsBaseUrl;
  private final String apiKey;

  public StaticSubscriptionUrlProvider(String wsBaseUrl, String apiKey) {
    this.wsBaseUrl = wsBaseUrl == null ? "" : wsBaseUrl.trim();
    this.apiKey = apiKey == null ? "" : apiKey.trim();
  }

  @Override
  public URI subscriptionUrl() {
    if (apiKey.isEmpty()) {
      throw new IllegalStateException("Dome API key not configured");
    }
    if (wsBaseUrl.isEmpty()) {
      throw new IllegalStateException("Dome websocket base URL not configured");
    }
    String base = wsBaseUrl.endsWith("/") ? wsBaseUrl.substring(0, wsBaseUrl.length() - 1) : wsBaseUrl;
    return URI.create(base + "/" + apiKey);
  }
}
