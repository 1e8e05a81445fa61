package com.polytape.http;

import lombok.Getter;

@Getter
public class HttpStatusException extends RuntimeException {

  private final int statusCode;
  private final String body;

  public HttpStatusException(String method, String uri, int statusCode, String body) {
    super("%s %s failed: HTTP %d %s".formatted(method, uri, statusCode, abbreviate(body)));
    this.statusCode = statusCode;
    this.body = body;
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= 200 ? body : body.substring(0, 200) + "...";
  }
}
