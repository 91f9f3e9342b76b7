package com.scholary.channel.insights.analytics;

import com.scholary.channel.insights.discovery.ContentDiscoveryService;
import com.scholary.channel.insights.discovery.ContentItem;
import com.scholary.channel.insights.discovery.Visibility;
import com.scholary.channel.insights.youtube.VideoPart;
import com.scholary.channel.insights.youtube.YouTubeApi;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reports channel performance by video length.
 *
 * <p>Enumerates every upload with its duration, sorts the videos into {@link DurationBucket}s and
 * runs the same cached, failure-isolated matrix as {@link ChannelAggregationService} with one row
 * per bucket. For a channel the caller does not own only public videos are counted.
 */
@Service
public class DurationAnalysisService {

  private static final Logger LOGGER = LoggerFactory.getLogger(DurationAnalysisService.class);

  private static final int ENUMERATION_SHARE = 30;

  private final ContentDiscoveryService discoveryService;
  private final ChannelAggregationService aggregationService;

  public DurationAnalysisService(
      ContentDiscoveryService discoveryService, ChannelAggregationService aggregationService) {
    this.discoveryService = discoveryService;
    this.aggregationService = aggregationService;
  }

  public AggregationReport analyze(
      YouTubeApi api,
      String channelId,
      List<DateRange> dateRanges,
      boolean ownChannel,
      ProgressReporter progress) {
    progress.report(0, "Listing channel videos");
    List<ContentItem> videos =
        discoveryService.listAll(
            api,
            channelId,
            EnumSet.of(VideoPart.SNIPPET, VideoPart.STATUS, VideoPart.CONTENT_DETAILS));

    Map<DurationBucket, List<String>> buckets = new EnumMap<>(DurationBucket.class);
    for (DurationBucket bucket : DurationBucket.values()) {
      buckets.put(bucket, new ArrayList<>());
    }
    int counted = 0;
    for (ContentItem video : videos) {
      if (!ownChannel && video.visibility() != Visibility.PUBLIC) {
        continue;
      }
      buckets.get(DurationBucket.of(video.durationSeconds())).add(video.itemId());
      counted++;
    }
    LOGGER.info("Bucketed {} of {} videos for channel {}", counted, videos.size(), channelId);

    List<ItemGroup> groups = new ArrayList<>();
    List<Map<String, Object>> bucketSummaries = new ArrayList<>();
    for (Map.Entry<DurationBucket, List<String>> entry : buckets.entrySet()) {
      DurationBucket bucket = entry.getKey();
      groups.add(new ItemGroup(bucket.label(), null, entry.getValue()));

      Map<String, Object> summary = new LinkedHashMap<>();
      summary.put("id", bucket.id());
      summary.put("label", bucket.label());
      summary.put("itemCount", entry.getValue().size());
      bucketSummaries.add(summary);
    }

    List<AggregationRow> rows =
        aggregationService.aggregateMatrix(
            api, channelId, groups, dateRanges, progress, ENUMERATION_SHARE);

    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("totalItems", counted);
    summary.put("buckets", bucketSummaries);
    return new AggregationReport(rows, ChannelAggregationService.labels(dateRanges), summary);
  }
}
