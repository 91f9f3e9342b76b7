package com.scholary.channel.insights.cache;

import com.scholary.channel.insights.analytics.MetricSet;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Short-lived cache of aggregation results.
 *
 * <p>Repeating a report within the cache window costs no analytics quota. Entries older than the
 * TTL read as absent.
 *
 * <p>Cache keys are based on: channel + sorted video ids + start date + end date
 */
public interface AnalyticsResultCache {

  /**
   * Store a result.
   *
   * @param cacheKey key from {@link #generateKey}
   * @param metrics the combined metrics
   */
  void put(String cacheKey, MetricSet metrics);

  /**
   * Retrieve a result.
   *
   * @param cacheKey key from {@link #generateKey}
   * @return the stored metrics, or empty if absent or expired
   */
  Optional<MetricSet> get(String cacheKey);

  /**
   * Drop every entry.
   *
   * @return how many entries were dropped
   */
  long clear();

  /**
   * Generate a cache key.
   *
   * <p>Ids are sorted so the same set of videos maps to the same key whatever order discovery
   * returned them in.
   */
  static String generateKey(
      String channelId, Collection<String> itemIds, LocalDate startDate, LocalDate endDate) {
    String ids = itemIds.stream().sorted().collect(Collectors.joining(","));
    return String.format("%s:%s:%s:%s", channelId, ids, startDate, endDate);
  }
}
