package com.polytape.livefeed.wallet;

import com.polytape.domain.Trade;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rolling activity of one wallet. Immutable: every recorded trade produces a new profile.
 */
public record WalletProfile(
        String wallet,
        long firstSeen,                         // epoch seconds, earliest observed trade
        long lastSeen,                          // epoch seconds, latest observed trade
        Instant lastUpdatedAt,                  // processing time of the last update
        List<Trade> history,                    // oldest first, bounded
        BigDecimal totalVolume,
        long tradeCount,
        Map<String, Integer> marketEntries      // per market slug
) {

    public WalletProfile {
        history = List.copyOf(history);
        marketEntries = Map.copyOf(marketEntries);
    }

    public static WalletProfile first(String wallet, Trade trade, Instant now) {
        Map<String, Integer> entries = new HashMap<>();
        entries.put(trade.marketSlug(), 1);
        return new WalletProfile(
                wallet,
                trade.timestamp(),
                trade.timestamp(),
                now,
                List.of(trade),
                trade.notional(),
                1,
                entries
        );
    }

    public WalletProfile plus(Trade trade, int maxHistory, Instant now) {
        List<Trade> nextHistory = new ArrayList<>(history.size() + 1);
        nextHistory.addAll(history);
        nextHistory.add(trade);
        if (nextHistory.size() > maxHistory) {
            nextHistory = nextHistory.subList(nextHistory.size() - maxHistory, nextHistory.size());
        }

        Map<String, Integer> nextEntries = new HashMap<>(marketEntries);
        nextEntries.merge(trade.marketSlug(), 1, Integer::sum);

        return new WalletProfile(
                wallet,
                Math.min(firstSeen, trade.timestamp()),
                Math.max(lastSeen, trade.timestamp()),
                now,
                nextHistory,
                totalVolume.add(trade.notional()),
                tradeCount + 1,
                nextEntries
        );
    }

    public BigDecimal averageTradeSize() {
        if (tradeCount == 0) {
            return BigDecimal.ZERO;
        }
        return totalVolume.divide(BigDecimal.valueOf(tradeCount), 2, RoundingMode.HALF_UP);
    }

    public int distinctMarkets() {
        return marketEntries.size();
    }
}
