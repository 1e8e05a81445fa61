package com.polytape.livefeed.stats;

import com.polytape.domain.MarketVolume;
import com.polytape.domain.TraderStats;

import java.time.Instant;
import java.util.List;

public record Rankings(
        List<TraderStats> topTraders,
        List<MarketVolume> topMarkets,
        Instant computedAt
) {

    public static Rankings empty(Instant computedAt) {
        return new Rankings(List.of(), List.of(), computedAt);
    }
}
