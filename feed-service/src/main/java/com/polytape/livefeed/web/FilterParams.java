package com.polytape.livefeed.web;

import com.polytape.domain.FilterState;
import com.polytape.domain.SignalType;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Builds a {@link FilterState} from query parameters. Bad values raise {@link IllegalArgumentException}.
 */
final class FilterParams {

  private FilterParams() {
  }

  static FilterState parse(
      String side,
      String minVolume,
      Boolean whalesOnly,
      String token,
      String market,
      String search,
      Boolean hideNoise,
      Boolean trackedOnly,
      Boolean signalOnly,
      String signals
  ) {
    return new FilterState(
        side == null || side.isBlank() ? FilterState.SideFilter.ALL : enumValue(FilterState.SideFilter.class, "side", side),
        decimal(minVolume),
        Boolean.TRUE.equals(whalesOnly),
        token == null || token.isBlank() ? FilterState.TokenSide.ALL : enumValue(FilterState.TokenSide.class, "token", token),
        market,
        search,
        Boolean.TRUE.equals(hideNoise),
        Boolean.TRUE.equals(trackedOnly),
        Boolean.TRUE.equals(signalOnly),
        signalSet(signals)
    );
  }

  private static <E extends Enum<E>> E enumValue(Class<E> type, String name, String raw) {
    try {
      return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("invalid %s: %s".formatted(name, raw));
    }
  }

  private static BigDecimal decimal(String raw) {
    if (raw == null || raw.isBlank()) {
      return BigDecimal.ZERO;
    }
    try {
      BigDecimal value = new BigDecimal(raw.trim());
      if (value.signum() < 0) {
        throw new IllegalArgumentException("minVolume must be >= 0");
      }
      return value;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid minVolume: " + raw);
    }
  }

  private static Set<SignalType> signalSet(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    Set<SignalType> out = EnumSet.noneOf(SignalType.class);
    for (String part : raw.split(",")) {
      if (!part.isBlank()) {
        out.add(SignalType.fromCode(part));
      }
    }
    return out;
  }
}
