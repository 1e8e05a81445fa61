package com.polytape.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * Sends requests and maps JSON responses with the shared {@link ObjectMapper}.
 * Non-2xx answers raise {@link HttpStatusException}.
 */
@Slf4j
public class JsonHttpTransport {

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  public JsonHttpTransport(@NonNull HttpClient httpClient, @NonNull ObjectMapper objectMapper) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public <T> T sendJson(HttpRequest request, Class<T> type) {
    String body = send(request);
    try {
      if (body == null || body.isBlank()) {
        return objectMapper.readValue("null", type);
      }
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed parsing response of %s %s".formatted(request.method(), request.uri()), e);
    }
  }

  public String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed serializing request body", e);
    }
  }

  private String send(HttpRequest request) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new UncheckedIOException("%s %s failed: %s".formatted(request.method(), request.uri(), e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during %s %s".formatted(request.method(), request.uri()), e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new HttpStatusException(request.method(), request.uri().toString(), status, response.body());
    }
    log.debug("{} {} -> {}", request.method(), request.uri().getPath(), status);
    return response.body();
  }
}
