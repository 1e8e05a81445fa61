package com.polytape.dome;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.polytape.domain.Trade;
import com.polytape.domain.TradeSide;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Wire codec for the Dome order stream and its REST orders endpoint.
 *
 * Trade payloads are read leniently: the venue uses different field names on its streaming and REST surfaces
 * (snake_case vs camelCase, {@code outcome} vs {@code token_label}, ...), so every field is looked up under its
 * known aliases.
 */
@Slf4j
public final class DomeCodec {

  private final ObjectMapper objectMapper;
  private final String platform;
  private final int protocolVersion;

  public DomeCodec(@NonNull ObjectMapper objectMapper, @NonNull String platform, int protocolVersion) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.platform = platform;
    this.protocolVersion = protocolVersion;
  }

  /**
   * Control frame requesting every order event on the platform.
   */
  public String subscribeFrame() {
    ObjectNode frame = objectMapper.createObjectNode();
    frame.put("action", "subscribe");
    frame.put("platform", platform);
    frame.put("version", protocolVersion);
    frame.put("type", "orders");
    ObjectNode filters = frame.putObject("filters");
    ArrayNode users = filters.putArray("users");
    users.add("*");
    try {
      return objectMapper.writeValueAsString(frame);
    } catch (IOException e) {
      throw new IllegalStateException("Failed serializing subscribe frame", e);
    }
  }

  public DomeFrame parseFrame(String text) {
    if (text == null || text.isBlank()) {
      throw new TradeDecodeException("empty frame");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new TradeDecodeException("malformed frame: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new TradeDecodeException("frame is not a JSON object");
    }

    String type = root.path("type").asText("");
    return switch (type) {
      case "ack" -> new DomeFrame(DomeFrame.Kind.ACK, text(root, "subscription_id", "subscriptionId"), null);
      case "event" -> new DomeFrame(DomeFrame.Kind.EVENT, null, root.path("data"));
      default -> new DomeFrame(DomeFrame.Kind.OTHER, null, null);
    };
  }

  public Trade decodeTrade(JsonNode raw) {
    if (raw == null || raw.isNull() || !raw.isObject()) {
      throw new TradeDecodeException("trade payload is not an object");
    }

    TradeSide side;
    try {
      side = TradeSide.parse(text(raw, "side"));
    } catch (IllegalArgumentException e) {
      throw new TradeDecodeException(e.getMessage(), e);
    }

    long timestamp = raw.path("timestamp").asLong(0);
    if (timestamp <= 0) {
      throw new TradeDecodeException("trade without timestamp");
    }
    if (timestamp > 1_000_000_000_000L) {
      timestamp = timestamp / 1000;
    }

    BigDecimal shares = decimal(raw, "shares", "size");
    BigDecimal sharesNormalized = decimal(raw, "shares_normalized", "sharesNormalized");
    if (sharesNormalized == null) {
      sharesNormalized = shares;
    }
    BigDecimal price = decimal(raw, "price");
    if (price == null) {
      throw new TradeDecodeException("trade without price");
    }

    String txHash = text(raw, "tx_hash", "txHash", "transactionHash");
    String orderHash = text(raw, "order_hash", "orderHash", "id");
    if ((txHash == null || txHash.isBlank()) && (orderHash == null || orderHash.isBlank())) {
      throw new TradeDecodeException("trade without tx or order hash");
    }

    return new Trade(
        text(raw, "token_id", "tokenId", "asset"),
        text(raw, "token_label", "tokenLabel", "outcome"),
        side,
        text(raw, "market_slug", "marketSlug", "slug"),
        text(raw, "condition_id", "conditionId"),
        shares,
        sharesNormalized,
        price,
        txHash,
        orderHash,
        text(raw, "title", "question", "market_title", "marketTitle"),
        lower(text(raw, "user", "maker", "wallet", "proxyWallet")),
        lower(text(raw, "taker")),
        timestamp,
        imageOf(raw)
    );
  }

  /**
   * Decodes an orders listing ({@code {orders: [...]}}, {@code {data: [...]}} or a bare array), skipping
   * entries that cannot be decoded.
   */
  public List<Trade> decodeOrders(JsonNode root) {
    JsonNode list = root;
    if (root != null && root.isObject()) {
      list = root.has("orders") ? root.get("orders") : root.path("data");
    }
    if (list == null || !list.isArray()) {
      return List.of();
    }

    List<Trade> trades = new ArrayList<>(list.size());
    for (JsonNode node : list) {
      try {
        trades.add(decodeTrade(node));
      } catch (TradeDecodeException e) {
        log.debug("skipping undecodable order: {}", e.getMessage());
      }
    }
    return trades;
  }

  static String imageOf(JsonNode raw) {
    String image = text(raw, "image", "market_image", "icon");
    return image == null || image.isBlank() ? null : image;
  }

  static String text(JsonNode node, String... names) {
    for (String name : names) {
      JsonNode v = node.get(name);
      if (v != null && !v.isNull()) {
        String s = v.asText("");
        if (!s.isBlank()) {
          return s.trim();
        }
      }
    }
    return null;
  }

  static BigDecimal decimal(JsonNode node, String... names) {
    for (String name : names) {
      JsonNode v = node.get(name);
      if (v == null || v.isNull()) {
        continue;
      }
      try {
        if (v.isNumber()) {
          return v.decimalValue();
        }
        String s = v.asText("").trim();
        if (!s.isEmpty()) {
          return new BigDecimal(s);
        }
      } catch (NumberFormatException e) {
        throw new TradeDecodeException("field %s is not numeric: %s".formatted(name, v.asText()), e);
      }
    }
    return null;
  }

  private static String lower(String s) {
    return s == null ? null : s.toLowerCase(Locale.ROOT);
  }
}
