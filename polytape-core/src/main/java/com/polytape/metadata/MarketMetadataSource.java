package com.polytape.metadata;

import java.util.List;

/**
 * Resolves display metadata for a batch of markets in one call.
 */
public interface MarketMetadataSource {

  List<MarketMetadata> lookup(MetadataRequest request);
}
