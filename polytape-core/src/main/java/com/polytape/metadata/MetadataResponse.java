package com.polytape.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MetadataResponse(List<MarketMetadata> markets) {

  public MetadataResponse {
    markets = markets == null ? List.of() : markets;
  }
}
