package com.scholary.channel.insights.analytics;

import com.scholary.channel.insights.cache.AnalyticsResultCache;
import com.scholary.channel.insights.discovery.ContentDiscoveryService;
import com.scholary.channel.insights.discovery.ContentItem;
import com.scholary.channel.insights.logging.StructuredLogger;
import com.scholary.channel.insights.quota.QuotaCost;
import com.scholary.channel.insights.quota.QuotaLedger;
import com.scholary.channel.insights.youtube.QuotaExceededException;
import com.scholary.channel.insights.youtube.YouTubeApi;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds keyword x date-range metric reports for a channel.
 *
 * <p>Discovery runs once per group and its ids are reused for every date range. Each cell is then
 * served from the {@link AnalyticsResultCache} or queried through {@link BatchMetricsQuery}.
 *
 * <p>Cells fail independently: a provider error, including quota exhaustion, is written into that
 * cell and the next cell is processed as usual. Only a discovery failure aborts the report.
 */
@Service
public class ChannelAggregationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelAggregationService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String UNKNOWN_COUNTRY = "Unknown";
  static final String ALL_VIDEOS = "(all videos)";
  static final String QUOTA_MESSAGE = "YouTube API quota exhausted, try again later";

  private static final int DISCOVERY_SHARE = 30;

  private final ContentDiscoveryService discoveryService;
  private final BatchMetricsQuery batchMetricsQuery;
  private final AnalyticsResultCache resultCache;
  private final QuotaLedger quotaLedger;

  public ChannelAggregationService(
      ContentDiscoveryService discoveryService,
      BatchMetricsQuery batchMetricsQuery,
      AnalyticsResultCache resultCache,
      QuotaLedger quotaLedger) {
    this.discoveryService = discoveryService;
    this.batchMetricsQuery = batchMetricsQuery;
    this.resultCache = resultCache;
    this.quotaLedger = quotaLedger;
  }

  /**
   * Build a report with one row per keyword group and one column per date range.
   *
   * @param api provider handle for the caller
   * @param channelId channel to report on
   * @param groups rows, in output order
   * @param dateRanges columns, in output order; labels must be unique
   * @param progress receives progress between steps
   * @return the report; failed cells carry an error instead of metrics
   */
  public AggregationReport aggregate(
      YouTubeApi api,
      String channelId,
      List<KeywordGroup> groups,
      List<DateRange> dateRanges,
      ProgressReporter progress) {
    DateRange.requireUniqueLabels(dateRanges);

    String country = channelCountry(api, channelId);
    LOGGER.info("Aggregating channel {} (country: {})", channelId, country);

    List<ItemGroup> itemGroups = new ArrayList<>(groups.size());
    for (int i = 0; i < groups.size(); i++) {
      KeywordGroup group = groups.get(i);
      progress.report(
          DISCOVERY_SHARE * i / groups.size(),
          "Finding videos for \"" + displayKeyword(group.keyword()) + "\"");
      List<String> ids =
          discoveryService.discover(api, channelId, group.keyword()).stream()
              .map(ContentItem::itemId)
              .toList();
      LOGGER.info("Group \"{}\": {} videos", group.name(), ids.size());
      itemGroups.add(new ItemGroup(group.name(), group.keyword(), ids));
    }

    List<AggregationRow> rows =
        aggregateMatrix(api, channelId, itemGroups, dateRanges, progress, DISCOVERY_SHARE);

    List<Map<String, Object>> groupSummaries = new ArrayList<>();
    for (ItemGroup group : itemGroups) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", group.name());
      entry.put("keyword", displayKeyword(group.keyword()));
      entry.put("itemCount", group.itemIds().size());
      groupSummaries.add(entry);
    }
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("channelCountry", country);
    summary.put("keywordGroups", groupSummaries);

    return new AggregationReport(rows, labels(dateRanges), summary);
  }

  /**
   * Fill the matrix for groups whose ids are already known.
   *
   * @param startPercent progress already reported by the caller; cells cover the rest up to 99
   */
  public List<AggregationRow> aggregateMatrix(
      YouTubeApi api,
      String channelId,
      List<ItemGroup> groups,
      List<DateRange> dateRanges,
      ProgressReporter progress,
      int startPercent) {
    DateRange.requireUniqueLabels(dateRanges);

    int totalCells = groups.size() * dateRanges.size();
    int done = 0;
    List<AggregationRow> rows = new ArrayList<>(groups.size());

    for (ItemGroup group : groups) {
      Map<String, AggregationCell> cells = new LinkedHashMap<>();
      for (DateRange range : dateRanges) {
        progress.report(
            startPercent + (99 - startPercent) * done / Math.max(totalCells, 1),
            "Querying " + group.name() + " / " + range.label());
        cells.put(range.label(), resolveCell(api, channelId, group, range));
        done++;
      }
      rows.add(new AggregationRow(group.name(), group.keyword(), group.itemIds().size(), cells));
    }
    return rows;
  }

  private AggregationCell resolveCell(
      YouTubeApi api, String channelId, ItemGroup group, DateRange range) {
    int itemCount = group.itemIds().size();
    if (itemCount == 0) {
      return AggregationCell.success(MetricSet.zero(), 0);
    }

    String cacheKey =
        AnalyticsResultCache.generateKey(
            channelId, group.itemIds(), range.startDate(), range.endDate());
    Optional<MetricSet> cached = resultCache.get(cacheKey);
    if (cached.isPresent()) {
      structuredLogger.logCellResolved(group.name(), range.label(), true, itemCount);
      return AggregationCell.success(cached.get(), itemCount);
    }

    try {
      MetricSet metrics = batchMetricsQuery.aggregate(api, channelId, group.itemIds(), range);
      resultCache.put(cacheKey, metrics);
      structuredLogger.logCellResolved(group.name(), range.label(), false, itemCount);
      return AggregationCell.success(metrics, itemCount);
    } catch (CancellationException e) {
      throw e;
    } catch (QuotaExceededException e) {
      structuredLogger.logCellFailed(
          group.name(), range.label(), AggregationCell.QUOTA_EXCEEDED, e.getMessage());
      return AggregationCell.failure(QUOTA_MESSAGE, AggregationCell.QUOTA_EXCEEDED, itemCount);
    } catch (RuntimeException e) {
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      structuredLogger.logCellFailed(
          group.name(), range.label(), AggregationCell.PROVIDER_ERROR, message);
      return AggregationCell.failure(message, AggregationCell.PROVIDER_ERROR, itemCount);
    }
  }

  /** Best effort: a failed lookup yields {@value #UNKNOWN_COUNTRY}. */
  private String channelCountry(YouTubeApi api, String channelId) {
    try {
      Optional<String> country = api.getChannelCountry(channelId);
      quotaLedger.record(
          QuotaCost.ACTION_CHANNELS,
          QuotaCost.CHANNELS_LIST,
          Map.of("part", "snippet", "context", "aggregation:country"));
      return country.filter(c -> !c.isBlank()).orElse(UNKNOWN_COUNTRY);
    } catch (RuntimeException e) {
      LOGGER.warn("Could not read country of channel {}: {}", channelId, e.getMessage());
      return UNKNOWN_COUNTRY;
    }
  }

  static List<String> labels(List<DateRange> dateRanges) {
    return dateRanges.stream().map(DateRange::label).toList();
  }

  private static String displayKeyword(String keyword) {
    return keyword == null || keyword.isBlank() ? ALL_VIDEOS : keyword;
  }
}
