package com.polytape.livefeed.web;

import com.polytape.domain.AnomalySignal;
import com.polytape.domain.Trade;
import com.polytape.domain.TradeSide;
import com.polytape.domain.WhaleTier;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record TradeView(
    String id,
    Instant executedAt,
    TradeSide side,
    String marketSlug,
    String conditionId,
    String title,
    String tokenId,
    String tokenLabel,
    BigDecimal price,
    BigDecimal shares,
    BigDecimal notional,
    String wallet,
    String taker,
    String txHash,
    String orderHash,
    String image,
    WhaleTier tier,
    List<AnomalySignal> signals
) {

  static TradeView of(Trade trade, WhaleTier tier, List<AnomalySignal> signals) {
    return new TradeView(
        trade.identity(),
        trade.executedAt(),
        trade.side(),
        trade.marketSlug(),
        trade.conditionId(),
        trade.title(),
        trade.tokenId(),
        trade.tokenLabel(),
        trade.price(),
        trade.effectiveShares(),
        trade.notional(),
        trade.wallet(),
        trade.taker(),
        trade.txHash(),
        trade.orderHash(),
        trade.image(),
        tier,
        signals
    );
  }
}
