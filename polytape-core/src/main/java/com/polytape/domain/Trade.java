package com.polytape.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A single fill on the venue, as delivered by the order stream.
 *
 * Instances are immutable once ingested. The only change a trade ever sees after ingestion is a display
 * image attached by {@link #withImage(String)}, which keeps the identity unchanged.
 */
public record Trade(
    String tokenId,
    String tokenLabel,         // "Yes" / "No" / "Up" / ...
    TradeSide side,
    String marketSlug,
    String conditionId,
    BigDecimal shares,         // raw share quantity
    BigDecimal sharesNormalized,
    BigDecimal price,          // 0..1 probability price
    String txHash,
    String orderHash,          // may be null
    String title,
    String wallet,             // the trade's principal ("user")
    String taker,
    long timestamp,            // epoch seconds
    String image               // resolved display image, may be null
) {

  public Trade {
    Objects.requireNonNull(side, "side");
    shares = shares == null ? BigDecimal.ZERO : shares;
    sharesNormalized = sharesNormalized == null ? BigDecimal.ZERO : sharesNormalized;
    price = price == null ? BigDecimal.ZERO : price;
    tokenId = tokenId == null ? "" : tokenId;
    tokenLabel = tokenLabel == null ? "" : tokenLabel;
    marketSlug = marketSlug == null ? "" : marketSlug;
    conditionId = conditionId == null ? "" : conditionId;
    txHash = txHash == null ? "" : txHash;
    title = title == null ? "" : title;
    wallet = wallet == null ? "" : wallet;
    taker = taker == null ? "" : taker;
    if (orderHash != null && orderHash.isBlank()) {
      orderHash = null;
    }
    if (image != null && image.isBlank()) {
      image = null;
    }
  }

  /**
   * Deduplication key: the order hash when present, else {@code (txHash, timestamp, tokenId)}.
   */
  public String identity() {
    if (orderHash != null) {
      return "order:" + orderHash;
    }
    return "tx:" + txHash + "|" + timestamp + "|" + tokenId;
  }

  /**
   * Share quantity used for sizing. Falls back to the raw quantity when the normalized one is missing.
   */
  public BigDecimal effectiveShares() {
    return sharesNormalized.signum() > 0 ? sharesNormalized : shares;
  }

  /**
   * Dollar-equivalent size: {@code price x normalized shares}.
   */
  public BigDecimal notional() {
    return price.multiply(effectiveShares());
  }

  public boolean hasImage() {
    return image != null;
  }

  public Instant executedAt() {
    return Instant.ofEpochSecond(timestamp);
  }

  public Trade withImage(String newImage) {
    return new Trade(tokenId, tokenLabel, side, marketSlug, conditionId, shares, sharesNormalized, price,
        txHash, orderHash, title, wallet, taker, timestamp, newImage);
  }
}
