package com.polytape.livefeed.enrich;

import com.polytape.config.FeedProperties;
import com.polytape.domain.Trade;
import com.polytape.livefeed.metrics.LiveFeedMetrics;
import com.polytape.metadata.MarketMetadata;
import com.polytape.metadata.MarketMetadataSource;
import com.polytape.metadata.MetadataRequest;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Resolves market images in coalesced batches.
 *
 * The cache is keyed by market slug and by condition id and lives as long as the process. A key moves from absent
 * to resolved or to negative, never back, so a failed key is not retried. Batching and cache writes happen on the
 * feed loop; the upstream call runs on the metadata executor.
 */
@Slf4j
public class MetadataEnricher {

  private static final String SLUG = "slug:";
  private static final String COND = "cond:";

  private final MarketMetadataSource source;
  private final ScheduledExecutorService loop;
  private final Executor io;
  private final FeedProperties.Metadata config;
  private final LiveFeedMetrics metrics;

  private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
  private final Set<String> pending = new LinkedHashSet<>();
  private final Set<String> inFlight = new HashSet<>();
  private final List<Runnable> resolvedListeners = new CopyOnWriteArrayList<>();

  private ScheduledFuture<?> debounce;

  public MetadataEnricher(
      @NonNull MarketMetadataSource source,
      @NonNull ScheduledExecutorService loop,
      @NonNull Executor io,
      @NonNull FeedProperties.Metadata config,
      @NonNull LiveFeedMetrics metrics
  ) {
    this.source = source;
    this.loop = loop;
    this.io = io;
    this.config = config;
    this.metrics = metrics;
  }

  /**
   * Registers a callback run on the feed loop after every completed batch.
   */
  public void onResolved(Runnable listener) {
    resolvedListeners.add(listener);
  }

  /**
   * Cached image for the market, queueing unresolved keys for the next batch. Feed loop only.
   */
  public Optional<String> resolve(String marketSlug, String conditionId) {
    Optional<String> cached = cachedImage(marketSlug, conditionId);
    if (cached.isPresent() || !config.enabled()) {
      return cached;
    }
    boolean queued = queue(SLUG, marketSlug) | queue(COND, conditionId);
    if (queued) {
      if (pending.size() >= config.batchSize()) {
        fireBatch();
      } else if (debounce == null) {
        debounce = loop.schedule(this::fireBatch, config.debounceMillis(), TimeUnit.MILLISECONDS);
      }
    }
    return Optional.empty();
  }

  public Optional<String> resolve(Trade trade) {
    return resolve(trade.marketSlug(), trade.conditionId());
  }

  /**
   * Cache lookup without queueing. Safe from any thread.
   */
  public Optional<String> cachedImage(String marketSlug, String conditionId) {
    String image = imageOf(SLUG, marketSlug);
    if (image == null) {
      image = imageOf(COND, conditionId);
    }
    return Optional.ofNullable(image);
  }

  public int cacheSize() {
    return cache.size();
  }

  public int pendingCount() {
    return pending.size();
  }

  void fireBatch() {
    if (debounce != null) {
      debounce.cancel(false);
      debounce = null;
    }
    if (pending.isEmpty()) {
      return;
    }

    List<String> keys = new ArrayList<>(pending);
    pending.clear();
    inFlight.addAll(keys);

    List<String> conditionIds = new ArrayList<>();
    List<String> eventSlugs = new ArrayList<>();
    for (String key : keys) {
      if (key.startsWith(COND)) {
        conditionIds.add(key.substring(COND.length()));
      } else {
        eventSlugs.add(key.substring(SLUG.length()));
      }
    }
    MetadataRequest request = new MetadataRequest(conditionIds, eventSlugs);

    io.execute(() -> {
      try {
        List<MarketMetadata> markets = source.lookup(request);
        loop.execute(() -> complete(keys, markets));
      } catch (Exception e) {
        log.warn("metadata lookup failed for {} keys: {}", keys.size(), e.toString());
        loop.execute(() -> complete(keys, null));
      }
    });
  }

  private void complete(List<String> keys, List<MarketMetadata> markets) {
    inFlight.removeAll(keys);
    int resolved = 0;
    if (markets != null) {
      // records with an image first, so an image-less duplicate cannot shadow them
      for (MarketMetadata market : markets) {
        if (market != null && market.hasImage()) {
          CacheEntry entry = new CacheEntry(market.image().trim());
          for (String key : keysOf(market)) {
            if (cache.putIfAbsent(key, entry) == null) {
              resolved++;
            }
          }
        }
      }
      for (MarketMetadata market : markets) {
        if (market != null && !market.hasImage()) {
          keysOf(market).forEach(key -> cache.putIfAbsent(key, CacheEntry.NEGATIVE));
        }
      }
    }
    int negatives = 0;
    for (String key : keys) {
      if (cache.putIfAbsent(key, CacheEntry.NEGATIVE) == null) {
        negatives++;
      }
    }
    metrics.metadataBatch(markets == null ? "failed" : "resolved", resolved);
    metrics.metadataBatch("negative", negatives);
    log.debug("metadata batch done: keys={} resolved={} negative={}", keys.size(), resolved, negatives);

    for (Runnable listener : resolvedListeners) {
      try {
        listener.run();
      } catch (Exception e) {
        log.warn("metadata listener failed: {}", e.toString());
      }
    }
  }

  private static List<String> keysOf(MarketMetadata market) {
    List<String> keys = new ArrayList<>(4);
    addKey(keys, COND, market.conditionId());
    addKey(keys, SLUG, market.slug());
    addKey(keys, SLUG, market.marketSlug());
    addKey(keys, SLUG, market.eventSlug());
    return keys;
  }

  private static void addKey(List<String> keys, String prefix, String value) {
    if (value != null && !value.isBlank()) {
      keys.add(prefix + value.trim());
    }
  }

  private boolean queue(String prefix, String value) {
    if (value == null || value.isBlank()) {
      return false;
    }
    String key = prefix + value.trim();
    if (cache.containsKey(key) || inFlight.contains(key)) {
      return false;
    }
    return pending.add(key);
  }

  private String imageOf(String prefix, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    CacheEntry entry = cache.get(prefix + value.trim());
    return entry == null ? null : entry.image();
  }

  private record CacheEntry(String image) {
    static final CacheEntry NEGATIVE = new CacheEntry(null);
  }
}
