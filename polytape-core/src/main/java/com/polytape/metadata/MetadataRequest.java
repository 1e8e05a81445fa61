package com.polytape.metadata;

import java.util.List;

public record MetadataRequest(
    List<String> conditionIds,
    List<String> eventSlugs
) {

  public MetadataRequest {
    conditionIds = conditionIds == null ? List.of() : List.copyOf(conditionIds);
    eventSlugs = eventSlugs == null ? List.of() : List.copyOf(eventSlugs);
  }

  public boolean isEmpty() {
    return conditionIds.isEmpty() && eventSlugs.isEmpty();
  }
}
