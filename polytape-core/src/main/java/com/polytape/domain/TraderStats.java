package com.polytape.domain;

import java.math.BigDecimal;

public record TraderStats(
    String wallet,
    BigDecimal volume,
    int trades,
    int markets,
    double buyPercent
) {
}
