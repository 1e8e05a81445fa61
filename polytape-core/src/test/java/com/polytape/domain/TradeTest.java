package com.polytape.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradeTest {

  private static final BigDecimal WHALE = BigDecimal.valueOf(1_000);
  private static final BigDecimal MEGA = BigDecimal.valueOf(10_000);

  @Test
  void identityPrefersOrderHash() {
    Trade withOrder = trade("0xtx", "0xorder", "1", "100");
    Trade blankOrder = trade("0xtx", "  ", "1", "100");

    assertThat(withOrder.identity()).isEqualTo("order:0xorder");
    assertThat(blankOrder.orderHash()).isNull();
    assertThat(blankOrder.identity()).isEqualTo("tx:0xtx|1700000000|tok");
  }

  @Test
  void notionalFallsBackToRawSharesWhenNormalizedMissing() {
    Trade normalized = new Trade("tok", "Yes", TradeSide.BUY, "m", "c", new BigDecimal("5000000"), new BigDecimal("5"),
        new BigDecimal("0.5"), "0xtx", null, "t", "0xw", "", 1_700_000_000L, null);
    Trade rawOnly = new Trade("tok", "Yes", TradeSide.BUY, "m", "c", new BigDecimal("40"), BigDecimal.ZERO,
        new BigDecimal("0.5"), "0xtx", null, "t", "0xw", "", 1_700_000_000L, null);

    assertThat(normalized.notional()).isEqualByComparingTo("2.5");
    assertThat(rawOnly.notional()).isEqualByComparingTo("20");
  }

  @Test
  void whaleBoundariesAreInclusive() {
    assertThat(WhaleTier.classify(new BigDecimal("999.99"), WHALE, MEGA)).isEqualTo(WhaleTier.NONE);
    assertThat(WhaleTier.classify(new BigDecimal("1000.00"), WHALE, MEGA)).isEqualTo(WhaleTier.WHALE);
    assertThat(WhaleTier.classify(new BigDecimal("9999.99"), WHALE, MEGA)).isEqualTo(WhaleTier.WHALE);
    assertThat(WhaleTier.classify(new BigDecimal("10000.00"), WHALE, MEGA)).isEqualTo(WhaleTier.MEGA);
  }

  @Test
  void withImageKeepsIdentity() {
    Trade trade = trade("0xtx", null, "1", "100");
    Trade patched = trade.withImage("https://img/a.png");

    assertThat(patched.identity()).isEqualTo(trade.identity());
    assertThat(patched.hasImage()).isTrue();
    assertThat(trade.hasImage()).isFalse();
  }

  @Test
  void sideParsingAcceptsShortForms() {
    assertThat(TradeSide.parse("b")).isEqualTo(TradeSide.BUY);
    assertThat(TradeSide.parse(" sell ")).isEqualTo(TradeSide.SELL);
    assertThatThrownBy(() -> TradeSide.parse("hold")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void filterStateDefaultsEnableEverySignal() {
    FilterState filter = FilterState.none().withSignalOnly(true, Set.of());

    assertThat(filter.enabledSignals()).containsExactlyInAnyOrder(SignalType.values());
    assertThat(filter.withMarketSlug(" ").marketSlug()).isNull();
    assertThat(FilterState.TokenSide.YES.accepts("yes")).isTrue();
    assertThat(FilterState.TokenSide.NO.accepts("Yes")).isFalse();
    assertThat(SignalType.fromCode("fresh_wallet")).isEqualTo(SignalType.FRESH_WALLET);
    assertThat(SignalType.fromCode("RAPID_CLUSTERING")).isEqualTo(SignalType.RAPID_CLUSTERING);
  }

  private static Trade trade(String txHash, String orderHash, String shares, String price) {
    return new Trade("tok", "Yes", TradeSide.BUY, "market", "0xcond", new BigDecimal(shares), new BigDecimal(shares),
        new BigDecimal(price), txHash, orderHash, "Title", "0xwallet", "0xtaker", 1_700_000_000L, null);
  }
}
