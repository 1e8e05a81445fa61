package com.polytape.domain;

import java.math.BigDecimal;
import java.time.Instant;

public record AggregateStats(
    BigDecimal totalVolume,
    BigDecimal buyVolume,
    BigDecimal sellVolume,
    int tradeCount,
    BigDecimal averageTradeSize,
    BigDecimal largestTrade,
    int whaleCount,
    /**
     * Share of flow on the buy side, in percent. 50 when there is no flow.
     */
    double buyPressurePct,
    /**
     * (buy - sell) / flow, in percent. Positive means net buying.
     */
    double flowImbalancePct,
    Instant computedAt
) {

  public static AggregateStats empty(Instant computedAt) {
    return new AggregateStats(
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        0,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        0,
        50.0,
        0.0,
        computedAt
    );
  }
}
