package com.polytape.livefeed.view;

import com.polytape.domain.Trade;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes trades as CSV: {@code timestamp,market,wallet,side,token,price,shares,volume}.
 */
public final class TradeCsvExporter {

  public static final String HEADER = "timestamp,market,wallet,side,token,price,shares,volume";

  private TradeCsvExporter() {
  }

  public static String toCsv(List<Trade> trades) {
    StringBuilder sb = new StringBuilder(64 * (trades.size() + 1));
    appendRows(sb, trades);
    return sb.toString();
  }

  public static void write(List<Trade> trades, Writer writer) {
    try {
      writer.write(toCsv(trades));
      writer.flush();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed writing trades CSV", e);
    }
  }

  private static void appendRows(StringBuilder sb, List<Trade> trades) {
    sb.append(HEADER).append('\n');
    for (Trade trade : trades) {
      sb.append(DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochSecond(trade.timestamp()))).append(',')
          .append(escape(trade.title())).append(',')
          .append(escape(trade.wallet())).append(',')
          .append(trade.side().name()).append(',')
          .append(escape(trade.tokenLabel())).append(',')
          .append(trade.price().toPlainString()).append(',')
          .append(trade.effectiveShares().toPlainString()).append(',')
          .append(trade.notional().setScale(2, RoundingMode.HALF_UP).toPlainString())
          .append('\n');
    }
  }

  static String escape(String value) {
    if (value == null) {
      return "";
    }
    if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
      return value;
    }
    return '"' + value.replace("\"", "\"\"") + '"';
  }
}
