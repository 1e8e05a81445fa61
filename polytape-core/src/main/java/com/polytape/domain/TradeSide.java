package com.polytape.domain;

import java.util.Locale;

public enum TradeSide {
  BUY,
  SELL;

  public static TradeSide parse(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("side is missing");
    }
    String s = raw.trim().toUpperCase(Locale.ROOT);
    return switch (s) {
      case "BUY", "B" -> BUY;
      case "SELL", "S" -> SELL;
      default -> throw new IllegalArgumentException("unknown side: " + raw);
    };
  }
}
