package com.polytape.livefeed.signal;

import com.polytape.config.FeedProperties;
import com.polytape.domain.AnomalySignal;
import com.polytape.domain.SignalType;
import com.polytape.domain.Trade;
import com.polytape.livefeed.wallet.WalletProfile;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags insider-like wallet behaviour from a trade and its wallet profile.
 *
 * Everything is evaluated as of the trade. Sizing and entry counts come from the profile's cumulative counters,
 * less the trade itself and whatever the bounded history holds after it, so they survive history trimming and
 * stay stable when a trade already in the log is re-evaluated against a profile that has since grown. Clustering
 * looks at history entries with a timestamp not after the trade. Thresholds do not decay.
 */
@Slf4j
public class SignalDetector {

    private final FeedProperties.Signals config;

    public SignalDetector(FeedProperties.Signals config) {
        this.config = config;
    }

    public List<AnomalySignal> detect(Trade trade, WalletProfile profile) {
        if (trade == null || profile == null) {
            return List.of();
        }
        try {
            return evaluate(trade, profile);
        } catch (RuntimeException e) {
            log.debug("signal detection failed for {}: {}", trade.identity(), e.toString());
            return List.of();
        }
    }

    private List<AnomalySignal> evaluate(Trade trade, WalletProfile profile) {
        String identity = trade.identity();
        String slug = trade.marketSlug();
        boolean recorded = false;
        List<Trade> prior = new ArrayList<>();
        long later = 0;
        long laterSameMarket = 0;
        BigDecimal laterVolume = BigDecimal.ZERO;
        for (Trade t : profile.history()) {
            if (t.identity().equals(identity)) {
                recorded = true;
            } else if (t.timestamp() <= trade.timestamp()) {
                prior.add(t);
            } else {
                later++;
                laterVolume = laterVolume.add(t.notional());
                if (t.marketSlug().equals(slug)) {
                    laterSameMarket++;
                }
            }
        }

        // cumulative counters minus this trade and anything recorded after it
        int self = recorded ? 1 : 0;
        long priorCount = profile.tradeCount() - self - later;
        BigDecimal priorVolume = profile.totalVolume()
                .subtract(recorded ? trade.notional() : BigDecimal.ZERO)
                .subtract(laterVolume);
        long sameMarket = profile.marketEntries().getOrDefault(slug, 0) - self - laterSameMarket;

        BigDecimal notional = trade.notional();
        List<AnomalySignal> signals = new ArrayList<>(4);

        // fresh_wallet
        long ageSeconds = Math.max(0, trade.timestamp() - profile.firstSeen());
        if (ageSeconds < config.freshWalletMaxAgeHours() * 3600
                && notional.compareTo(config.freshWalletMinNotionalUsd()) >= 0) {
            signals.add(new AnomalySignal(SignalType.FRESH_WALLET, "Wallet age: " + formatAge(ageSeconds)));
        }

        // unusual_sizing
        if (priorCount > 0 && priorVolume.signum() > 0) {
            BigDecimal priorAvg = priorVolume.divide(BigDecimal.valueOf(priorCount), 8, RoundingMode.HALF_UP);
            if (notional.compareTo(priorAvg.multiply(config.unusualSizingMultiplier())) > 0) {
                BigDecimal ratio = notional.divide(priorAvg, 0, RoundingMode.HALF_UP);
                signals.add(new AnomalySignal(SignalType.UNUSUAL_SIZING, ratio.toPlainString() + "x avg size"));
            }
        }

        // repeated_entries
        if (!slug.isEmpty() && sameMarket >= config.repeatedEntriesThreshold()) {
            signals.add(new AnomalySignal(SignalType.REPEATED_ENTRIES, (sameMarket + 1) + " entries in market"));
        }

        // rapid_clustering
        long windowStart = trade.timestamp() - config.clusterWindowMinutes() * 60;
        long inWindow = 1 + prior.stream()
                .filter(t -> t.timestamp() >= windowStart)
                .count();
        if (inWindow >= config.clusterMinTrades()) {
            signals.add(new AnomalySignal(SignalType.RAPID_CLUSTERING,
                    inWindow + " trades in " + config.clusterWindowMinutes() + "m"));
        }

        return List.copyOf(signals);
    }

    private static String formatAge(long ageSeconds) {
        if (ageSeconds < 3600) {
            return (ageSeconds / 60) + "m";
        }
        return (ageSeconds / 3600) + "h";
    }
}
