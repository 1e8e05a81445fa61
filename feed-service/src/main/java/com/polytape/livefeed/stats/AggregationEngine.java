package com.polytape.livefeed.stats;

import com.polytape.config.FeedProperties;
import com.polytape.domain.AggregateStats;
import com.polytape.domain.MarketVolume;
import com.polytape.domain.Trade;
import com.polytape.domain.TradeSide;
import com.polytape.domain.TraderStats;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rolling statistics over the canonical trade log.
 *
 * Stats and rankings run on their own ticks; each tick reads one immutable log snapshot and publishes an immutable
 * result, so readers never see a half-computed value.
 */
@Slf4j
public class AggregationEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final FeedProperties.Whales whales;
    private final FeedProperties.Aggregation config;
    private final Clock clock;

    private final AtomicReference<AggregateStats> stats;
    private final AtomicReference<Rankings> rankings;

    public AggregationEngine(FeedProperties.Whales whales, FeedProperties.Aggregation config, Clock clock) {
        this.whales = whales;
        this.config = config;
        this.clock = clock;
        this.stats = new AtomicReference<>(AggregateStats.empty(clock.instant()));
        this.rankings = new AtomicReference<>(Rankings.empty(clock.instant()));
    }

    public AggregateStats refreshStats(List<Trade> log) {
        AggregateStats next = computeStats(log);
        stats.set(next);
        return next;
    }

    public Rankings refreshRankings(List<Trade> log) {
        Rankings next = computeRankings(log);
        rankings.set(next);
        return next;
    }

    public AggregateStats stats() {
        return stats.get();
    }

    public Rankings rankings() {
        return rankings.get();
    }

    AggregateStats computeStats(List<Trade> log) {
        if (log == null || log.isEmpty()) {
            return AggregateStats.empty(clock.instant());
        }

        BigDecimal buy = BigDecimal.ZERO;
        BigDecimal sell = BigDecimal.ZERO;
        BigDecimal largest = BigDecimal.ZERO;
        int whaleCount = 0;

        for (Trade trade : log) {
            BigDecimal notional = trade.notional();
            if (trade.side() == TradeSide.BUY) {
                buy = buy.add(notional);
            } else {
                sell = sell.add(notional);
            }
            if (notional.compareTo(largest) > 0) {
                largest = notional;
            }
            if (notional.compareTo(whales.whaleThresholdUsd()) >= 0) {
                whaleCount++;
            }
        }

        BigDecimal total = buy.add(sell);
        BigDecimal average = total.divide(BigDecimal.valueOf(log.size()), 2, RoundingMode.HALF_UP);
        double buyPressure = 50.0;
        double imbalance = 0.0;
        if (total.signum() > 0) {
            buyPressure = percent(buy, total);
            imbalance = percent(buy.subtract(sell), total);
        }

        return new AggregateStats(
                total,
                buy,
                sell,
                log.size(),
                average,
                largest,
                whaleCount,
                buyPressure,
                imbalance,
                clock.instant()
        );
    }

    Rankings computeRankings(List<Trade> log) {
        if (log == null || log.isEmpty()) {
            return Rankings.empty(clock.instant());
        }

        Map<String, TraderAccumulator> byWallet = new HashMap<>();
        Map<String, MarketAccumulator> byMarket = new LinkedHashMap<>();

        for (Trade trade : log) {
            BigDecimal notional = trade.notional();
            if (!trade.wallet().isEmpty()) {
                byWallet.computeIfAbsent(trade.wallet(), k -> new TraderAccumulator()).add(trade, notional);
            }
            if (!trade.marketSlug().isEmpty()) {
                byMarket.computeIfAbsent(trade.marketSlug(), k -> new MarketAccumulator()).add(trade, notional);
            }
        }

        List<TraderStats> topTraders = byWallet.entrySet().stream()
                .map(e -> e.getValue().toStats(e.getKey()))
                .sorted(Comparator.comparing(TraderStats::volume).reversed())
                .limit(config.topN())
                .toList();

        List<MarketVolume> topMarkets = byMarket.entrySet().stream()
                .map(e -> e.getValue().toVolume(e.getKey()))
                .sorted(Comparator.comparing(MarketVolume::volume).reversed())
                .limit(config.topN())
                .toList();

        return new Rankings(topTraders, topMarkets, clock.instant());
    }

    private static double percent(BigDecimal part, BigDecimal whole) {
        return part.multiply(HUNDRED).divide(whole, 4, RoundingMode.HALF_UP).doubleValue();
    }

    private static final class TraderAccumulator {
        private BigDecimal volume = BigDecimal.ZERO;
        private int trades;
        private int buys;
        private final Set<String> markets = new HashSet<>();

        void add(Trade trade, BigDecimal notional) {
            volume = volume.add(notional);
            trades++;
            if (trade.side() == TradeSide.BUY) buys++;
            if (!trade.marketSlug().isEmpty()) markets.add(trade.marketSlug());
        }

        TraderStats toStats(String wallet) {
            double buyPercent = trades == 0 ? 0.0 : buys * 100.0 / trades;
            return new TraderStats(wallet, volume, trades, markets.size(), buyPercent);
        }
    }

    private static final class MarketAccumulator {
        private BigDecimal volume = BigDecimal.ZERO;
        private int trades;
        private String title;
        private String image;

        void add(Trade trade, BigDecimal notional) {
            volume = volume.add(notional);
            trades++;
            // log is newest first, keep the first non-empty values seen
            if (title == null && !trade.title().isEmpty()) title = trade.title();
            if (image == null && trade.hasImage()) image = trade.image();
        }

        MarketVolume toVolume(String slug) {
            return new MarketVolume(slug, title == null ? slug : title, image, volume, trades);
        }
    }
}
