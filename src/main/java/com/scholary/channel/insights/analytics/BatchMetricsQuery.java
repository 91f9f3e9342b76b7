package com.scholary.channel.insights.analytics;

import com.scholary.channel.insights.chunking.IdChunker;
import com.scholary.channel.insights.config.AnalyticsProperties;
import com.scholary.channel.insights.quota.QuotaCost;
import com.scholary.channel.insights.quota.QuotaLedger;
import com.scholary.channel.insights.youtube.AnalyticsReport;
import com.scholary.channel.insights.youtube.YouTubeApi;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Queries analytics for an arbitrarily large set of videos, one chunk of ids per query. */
@Component
public class BatchMetricsQuery {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchMetricsQuery.class);

  private final QuotaLedger quotaLedger;
  private final int chunkSize;

  public BatchMetricsQuery(QuotaLedger quotaLedger, AnalyticsProperties properties) {
    this.quotaLedger = quotaLedger;
    this.chunkSize = properties.chunkSize();
  }

  /**
   * Aggregate metrics for {@code itemIds} over {@code range}.
   *
   * @return combined metrics, never null; zero when no chunk returned data
   * @throws com.scholary.channel.insights.youtube.YouTubeApiException if any chunk query fails
   */
  public MetricSet aggregate(
      YouTubeApi api, String channelId, List<String> itemIds, DateRange range) {
    if (itemIds.isEmpty()) {
      return MetricSet.zero();
    }

    List<List<String>> chunks = IdChunker.chunk(itemIds, chunkSize);
    List<MetricSet> results = new ArrayList<>(chunks.size());

    for (int i = 0; i < chunks.size(); i++) {
      List<String> chunk = chunks.get(i);
      AnalyticsReport report =
          api.queryVideoMetrics(
              channelId, chunk, Metric.apiNames(), range.startDate(), range.endDate());
      quotaLedger.record(
          QuotaCost.ACTION_ANALYTICS,
          QuotaCost.ANALYTICS_REPORTS_QUERY,
          Map.of(
              "videos", chunk.size(),
              "chunk", i + 1,
              "dateRange", range.startDate() + " ~ " + range.endDate()));

      if (!report.isEmpty()) {
        results.add(MetricSet.fromRow(report.columns(), report.rows().get(0)));
      }
    }

    LOGGER.debug(
        "Queried {} videos in {} chunks for {}, {} returned data",
        itemIds.size(),
        chunks.size(),
        range.label(),
        results.size());
    return MetricsCombiner.combine(results);
  }
}
