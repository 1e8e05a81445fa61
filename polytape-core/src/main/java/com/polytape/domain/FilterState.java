package com.polytape.domain;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

/**
 * Active predicate configuration of the materialized trade view. A plain value: every change produces a new
 * instance and the view is recomputed from it.
 */
public record FilterState(
    SideFilter side,
    BigDecimal minVolume,
    boolean whalesOnly,
    TokenSide tokenSide,
    String marketSlug,         // null or blank = every market
    String searchTerm,
    boolean hideNoiseMarkets,
    boolean trackedOnly,
    boolean signalOnly,
    Set<SignalType> enabledSignals
) {

  public FilterState {
    if (side == null) {
      side = SideFilter.ALL;
    }
    if (minVolume == null || minVolume.signum() < 0) {
      minVolume = BigDecimal.ZERO;
    }
    if (tokenSide == null) {
      tokenSide = TokenSide.ALL;
    }
    if (marketSlug != null && marketSlug.isBlank()) {
      marketSlug = null;
    }
    if (searchTerm != null) {
      searchTerm = searchTerm.trim();
      if (searchTerm.isEmpty()) {
        searchTerm = null;
      }
    }
    enabledSignals = enabledSignals == null || enabledSignals.isEmpty()
        ? Set.copyOf(EnumSet.allOf(SignalType.class))
        : Set.copyOf(enabledSignals);
  }

  public static FilterState none() {
    return new FilterState(SideFilter.ALL, BigDecimal.ZERO, false, TokenSide.ALL, null, null, false, false, false, null);
  }

  public FilterState withSide(SideFilter newSide) {
    return new FilterState(newSide, minVolume, whalesOnly, tokenSide, marketSlug, searchTerm, hideNoiseMarkets,
        trackedOnly, signalOnly, enabledSignals);
  }

  public FilterState withMinVolume(BigDecimal newMinVolume) {
    return new FilterState(side, newMinVolume, whalesOnly, tokenSide, marketSlug, searchTerm, hideNoiseMarkets,
        trackedOnly, signalOnly, enabledSignals);
  }

  public FilterState withWhalesOnly(boolean newWhalesOnly) {
    return new FilterState(side, minVolume, newWhalesOnly, tokenSide, marketSlug, searchTerm, hideNoiseMarkets,
        trackedOnly, signalOnly, enabledSignals);
  }

  public FilterState withTokenSide(TokenSide newTokenSide) {
    return new FilterState(side, minVolume, whalesOnly, newTokenSide, marketSlug, searchTerm, hideNoiseMarkets,
        trackedOnly, signalOnly, enabledSignals);
  }

  public FilterState withMarketSlug(String newMarketSlug) {
    return new FilterState(side, minVolume, whalesOnly, tokenSide, newMarketSlug, searchTerm, hideNoiseMarkets,
        trackedOnly, signalOnly, enabledSignals);
  }

  public FilterState withSearchTerm(String newSearchTerm) {
    return new FilterState(side, minVolume, whalesOnly, tokenSide, marketSlug, newSearchTerm, hideNoiseMarkets,
        trackedOnly, signalOnly, enabledSignals);
  }

  public FilterState withHideNoiseMarkets(boolean newHideNoiseMarkets) {
    return new FilterState(side, minVolume, whalesOnly, tokenSide, marketSlug, searchTerm, newHideNoiseMarkets,
        trackedOnly, signalOnly, enabledSignals);
  }

  public FilterState withTrackedOnly(boolean newTrackedOnly) {
    return new FilterState(side, minVolume, whalesOnly, tokenSide, marketSlug, searchTerm, hideNoiseMarkets,
        newTrackedOnly, signalOnly, enabledSignals);
  }

  public FilterState withSignalOnly(boolean newSignalOnly, Set<SignalType> newEnabledSignals) {
    return new FilterState(side, minVolume, whalesOnly, tokenSide, marketSlug, searchTerm, hideNoiseMarkets,
        trackedOnly, newSignalOnly, newEnabledSignals);
  }

  public enum SideFilter {
    ALL,
    BUY,
    SELL;

    public boolean accepts(TradeSide tradeSide) {
      return switch (this) {
        case ALL -> true;
        case BUY -> tradeSide == TradeSide.BUY;
        case SELL -> tradeSide == TradeSide.SELL;
      };
    }
  }

  public enum TokenSide {
    ALL,
    YES,
    NO;

    public boolean accepts(String tokenLabel) {
      if (this == ALL) {
        return true;
      }
      return tokenLabel != null && tokenLabel.trim().equalsIgnoreCase(name());
    }
  }
}
