package com.polytape.livefeed.ws;

import lombok.Getter;

@Getter
public class FeedConnectException extends Exception {

  private final ConnectFailure failure;

  public FeedConnectException(ConnectFailure failure, String message) {
    super(message);
    this.failure = failure;
  }

  public FeedConnectException(ConnectFailure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = failure;
  }
}
