package com.polytape.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One market record from the metadata resolution endpoint. Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MarketMetadata(
    String slug,
    String conditionId,
    String marketSlug,
    String eventSlug,
    String image
) {

  public boolean hasImage() {
    return image != null && !image.isBlank();
  }
}
