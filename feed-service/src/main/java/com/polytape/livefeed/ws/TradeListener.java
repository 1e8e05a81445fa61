package com.polytape.livefeed.ws;

import com.polytape.domain.Trade;

@FunctionalInterface
public interface TradeListener {

  void onTrade(Trade trade);
}
