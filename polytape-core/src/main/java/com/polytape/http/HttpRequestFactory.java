package com.polytape.http;

import lombok.NonNull;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds requests relative to a base URI. The base path is kept, so {@code https://host/v1} + {@code /orders}
 * resolves to {@code https://host/v1/orders}.
 */
public final class HttpRequestFactory {

  private final URI baseUri;

  public HttpRequestFactory(@NonNull URI baseUri) {
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
  }

  public HttpRequest.Builder request(String path, Map<String, String> query) {
    return HttpRequest.newBuilder(resolve(path, query));
  }

  public URI resolve(String path, Map<String, String> query) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String p = path == null || path.isBlank() ? "" : (path.startsWith("/") ? path : "/" + path);
    String qs = query == null || query.isEmpty() ? "" : "?" + query.entrySet().stream()
        .filter(e -> e.getValue() != null)
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
    return URI.create(base + p + qs);
  }

  private static String encode(String v) {
    return URLEncoder.encode(v, StandardCharsets.UTF_8);
  }
}
