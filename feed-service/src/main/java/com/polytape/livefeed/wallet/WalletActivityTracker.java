package com.polytape.livefeed.wallet;

import com.polytape.config.FeedProperties;
import com.polytape.domain.Trade;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps a {@link WalletProfile} per wallet seen on the feed.
 *
 * Profiles are bounded twice: wallets idle for longer than the TTL are dropped on the eviction tick, and when the
 * map grows past the cap the least recently updated wallets go first.
 */
@Slf4j
public class WalletActivityTracker {

    private final FeedProperties.Wallets config;
    private final Clock clock;
    private final Map<String, WalletProfile> profiles = new ConcurrentHashMap<>();

    public WalletActivityTracker(FeedProperties.Wallets config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Record a trade against its wallet.
     *
     * @return the updated profile, or empty when the trade has no wallet
     */
    public Optional<WalletProfile> record(Trade trade) {
        String key = key(trade.wallet());
        if (key == null) return Optional.empty();

        Instant now = clock.instant();
        WalletProfile updated = profiles.compute(key, (k, prev) -> prev == null
                ? WalletProfile.first(k, trade, now)
                : prev.plus(trade, config.maxHistoryPerWallet(), now));
        return Optional.of(updated);
    }

    public Optional<WalletProfile> profile(String wallet) {
        String key = key(wallet);
        return key == null ? Optional.empty() : Optional.ofNullable(profiles.get(key));
    }

    /**
     * Drop idle profiles, then trim to the cap by least recent update.
     *
     * @return number of profiles evicted
     */
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(config.idleTtlMinutes()));
        int before = profiles.size();
        profiles.values().removeIf(p -> p.lastUpdatedAt().isBefore(cutoff));

        int excess = profiles.size() - config.maxWallets();
        if (excess > 0) {
            List<String> oldest = profiles.values().stream()
                    .sorted(Comparator.comparing(WalletProfile::lastUpdatedAt))
                    .limit(excess)
                    .map(WalletProfile::wallet)
                    .toList();
            oldest.forEach(profiles::remove);
        }

        int evicted = before - profiles.size();
        if (evicted > 0) {
            log.debug("evicted {} wallet profiles, {} tracked", evicted, profiles.size());
        }
        return evicted;
    }

    public int size() {
        return profiles.size();
    }

    private static String key(String wallet) {
        if (wallet == null || wallet.isBlank()) return null;
        return wallet.trim().toLowerCase(Locale.ROOT);
    }
}
