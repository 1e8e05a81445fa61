package com.polytape.livefeed.ingest;

import com.polytape.domain.Trade;
import com.polytape.domain.WhaleTier;

import java.math.BigDecimal;
import java.time.Instant;

public record WhaleAlert(
    Trade trade,
    WhaleTier tier,
    BigDecimal notional,
    Instant raisedAt
) {
}
