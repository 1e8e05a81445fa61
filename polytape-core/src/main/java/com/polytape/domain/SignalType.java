package com.polytape.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalType {
  FRESH_WALLET("fresh_wallet"),
  UNUSUAL_SIZING("unusual_sizing"),
  REPEATED_ENTRIES("repeated_entries"),
  RAPID_CLUSTERING("rapid_clustering");

  private final String code;

  SignalType(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  @JsonCreator
  public static SignalType fromCode(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("signal type is blank");
    }
    String s = raw.trim();
    for (SignalType type : values()) {
      if (type.code.equalsIgnoreCase(s) || type.name().equalsIgnoreCase(s)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown signal type: " + raw);
  }
}
