package com.polytape.domain;

import java.math.BigDecimal;

public record MarketVolume(
    String slug,
    String title,
    String image,
    BigDecimal volume,
    int trades
) {
}
