package com.scholary.channel.insights.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.channel.insights.analytics.MetricSet;
import com.scholary.channel.insights.config.AnalyticsProperties;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-memory implementation of AnalyticsResultCache using Caffeine.
 *
 * <p>Entries expire a fixed time after they were written (15 minutes by default). Expired entries
 * are dropped by a periodic sweep. There is no size bound; the key space is limited by how many
 * distinct reports are requested within one TTL window.
 */
@Component
public class InMemoryAnalyticsResultCache implements AnalyticsResultCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryAnalyticsResultCache.class);

  private final Cache<String, MetricSet> cache;

  public InMemoryAnalyticsResultCache(AnalyticsProperties properties, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofMinutes(properties.cacheTtlMinutes()))
            .ticker(ticker)
            .recordStats()
            .build();

    LOGGER.info("Initialized analytics result cache: ttlMinutes={}", properties.cacheTtlMinutes());
  }

  @Override
  public void put(String cacheKey, MetricSet metrics) {
    cache.put(cacheKey, metrics);
    LOGGER.debug("Cached result: key={}", abbreviate(cacheKey));
  }

  @Override
  public Optional<MetricSet> get(String cacheKey) {
    MetricSet metrics = cache.getIfPresent(cacheKey);
    if (metrics != null) {
      LOGGER.debug("Cache hit: key={}", abbreviate(cacheKey));
      return Optional.of(metrics);
    } else {
      LOGGER.debug("Cache miss: key={}", abbreviate(cacheKey));
      return Optional.empty();
    }
  }

  @Override
  public long clear() {
    cache.cleanUp();
    long size = cache.estimatedSize();
    cache.invalidateAll();
    LOGGER.info("Cleared {} cached results", size);
    return size;
  }

  /** Drop expired entries. */
  @Scheduled(fixedDelayString = "${analytics.cacheSweepIntervalMs:1800000}")
  public void sweep() {
    cache.cleanUp();
    LOGGER.debug(getStats());
  }

  /**
   * Get cache statistics for monitoring.
   *
   * @return cache stats
   */
  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "AnalyticsResultCache[size=%d, hitRate=%.2f%%, evictions=%d]",
        cache.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }

  // Keys embed up to thousands of video ids.
  private static String abbreviate(String cacheKey) {
    return cacheKey.length() <= 120 ? cacheKey : cacheKey.substring(0, 120) + "...";
  }
}
