package com.polytape.livefeed.view;

import com.polytape.config.FeedProperties;
import com.polytape.domain.AnomalySignal;
import com.polytape.domain.FilterState;
import com.polytape.domain.Trade;
import com.polytape.livefeed.signal.SignalDetector;
import com.polytape.livefeed.wallet.WalletActivityTracker;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Applies a {@link FilterState} to the trade buffers.
 *
 * Whales-only views read the whale buffer, everything else reads the canonical log. Predicates short-circuit in a
 * fixed order with the signal check last, since it is the only one that needs the wallet profile.
 */
@RequiredArgsConstructor
public class ViewMaterializer {

  private final @NonNull FeedProperties.Whales whales;
  private final @NonNull SignalDetector signalDetector;
  private final @NonNull WalletActivityTracker walletTracker;

  public List<Trade> materialize(List<Trade> canonicalLog, List<Trade> whaleBuffer, FilterState filter,
                                 Set<String> trackedWallets) {
    FilterState f = filter == null ? FilterState.none() : filter;
    List<Trade> source = f.whalesOnly() ? whaleBuffer : canonicalLog;
    if (source == null || source.isEmpty()) {
      return List.of();
    }
    if (f.trackedOnly() && (trackedWallets == null || trackedWallets.isEmpty())) {
      return List.of();
    }

    String search = f.searchTerm() == null ? null : f.searchTerm().toLowerCase(Locale.ROOT);
    List<Trade> out = new ArrayList<>();
    for (Trade trade : source) {
      if (accepts(trade, f, search, trackedWallets)) {
        out.add(trade);
      }
    }
    return List.copyOf(out);
  }

  public List<AnomalySignal> signalsFor(Trade trade) {
    return walletTracker.profile(trade.wallet())
        .map(profile -> signalDetector.detect(trade, profile))
        .orElse(List.of());
  }

  private boolean accepts(Trade trade, FilterState f, String search, Set<String> trackedWallets) {
    if (!f.side().accepts(trade.side())) {
      return false;
    }
    if (f.minVolume().signum() > 0 && trade.notional().compareTo(f.minVolume()) < 0) {
      return false;
    }
    if (f.whalesOnly() && trade.notional().compareTo(whales.whaleThresholdUsd()) < 0) {
      return false;
    }
    if (!f.tokenSide().accepts(trade.tokenLabel())) {
      return false;
    }
    if (f.marketSlug() != null && !f.marketSlug().equals(trade.marketSlug())) {
      return false;
    }
    if (f.hideNoiseMarkets() && isNoiseMarket(trade)) {
      return false;
    }
    if (search != null && !matchesSearch(trade, search)) {
      return false;
    }
    if (f.trackedOnly()) {
      String wallet = TrackedWallets.normalize(trade.wallet());
      if (wallet == null || !trackedWallets.contains(wallet)) {
        return false;
      }
    }
    if (f.signalOnly()) {
      return signalsFor(trade).stream().anyMatch(s -> f.enabledSignals().contains(s.type()));
    }
    return true;
  }

  static boolean isNoiseMarket(Trade trade) {
    String label = trade.tokenLabel().trim();
    return trade.title().toLowerCase(Locale.ROOT).contains("up or down")
        || label.equalsIgnoreCase("up")
        || label.equalsIgnoreCase("down");
  }

  private static boolean matchesSearch(Trade trade, String search) {
    return trade.title().toLowerCase(Locale.ROOT).contains(search)
        || trade.wallet().toLowerCase(Locale.ROOT).contains(search)
        || trade.marketSlug().toLowerCase(Locale.ROOT).contains(search);
  }
}
