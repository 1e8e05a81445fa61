package com.polytape.dome;

public class TradeDecodeException extends RuntimeException {

  public TradeDecodeException(String message) {
    super(message);
  }

  public TradeDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
