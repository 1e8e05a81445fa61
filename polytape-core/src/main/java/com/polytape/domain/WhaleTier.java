package com.polytape.domain;

import java.math.BigDecimal;

/**
 * Size class of a trade by notional. Thresholds are inclusive.
 */
public enum WhaleTier {
  NONE,
  WHALE,
  MEGA;

  public static WhaleTier classify(BigDecimal notional, BigDecimal whaleThreshold, BigDecimal megaThreshold) {
    if (notional == null) {
      return NONE;
    }
    if (notional.compareTo(megaThreshold) >= 0) {
      return MEGA;
    }
    if (notional.compareTo(whaleThreshold) >= 0) {
      return WHALE;
    }
    return NONE;
  }

  public boolean isWhale() {
    return this != NONE;
  }
}
