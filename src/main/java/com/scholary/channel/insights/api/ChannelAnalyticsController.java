package com.scholary.channel.insights.api;

import com.scholary.channel.insights.analytics.ChannelAggregationService;
import com.scholary.channel.insights.analytics.DateRange;
import com.scholary.channel.insights.analytics.DurationAnalysisService;
import com.scholary.channel.insights.analytics.KeywordGroup;
import com.scholary.channel.insights.cache.AnalyticsResultCache;
import com.scholary.channel.insights.job.JobExecutor;
import com.scholary.channel.insights.youtube.YouTubeApi;
import com.scholary.channel.insights.youtube.YouTubeApiFactory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for channel analytics reports.
 *
 * <p>Reports take from seconds to minutes, so both report endpoints start a background job and
 * answer 202 with its id; clients poll {@code /api/jobs/{id}} for the result.
 */
@RestController
@RequestMapping("/api/channel-analytics")
@Tag(name = "Channel analytics", description = "Keyword and duration reports over date ranges")
public class ChannelAnalyticsController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelAnalyticsController.class);

  static final String AGGREGATE_JOB = "channel-aggregate";
  static final String DURATION_JOB = "duration-analysis";

  private final JobExecutor jobExecutor;
  private final YouTubeApiFactory apiFactory;
  private final ChannelAggregationService aggregationService;
  private final DurationAnalysisService durationAnalysisService;
  private final AnalyticsResultCache resultCache;

  public ChannelAnalyticsController(
      JobExecutor jobExecutor,
      YouTubeApiFactory apiFactory,
      ChannelAggregationService aggregationService,
      DurationAnalysisService durationAnalysisService,
      AnalyticsResultCache resultCache) {
    this.jobExecutor = jobExecutor;
    this.apiFactory = apiFactory;
    this.aggregationService = aggregationService;
    this.durationAnalysisService = durationAnalysisService;
    this.resultCache = resultCache;
  }

  @PostMapping("/aggregate")
  @Operation(
      summary = "Start a keyword x date-range report",
      description =
          "Finds the channel's videos for each keyword group and aggregates their analytics for "
              + "each date range. Returns a job id to poll.")
  public ResponseEntity<AsyncJobResponse> aggregate(@Valid @RequestBody AggregateRequest request) {
    List<KeywordGroup> groups =
        request.keywordGroups().stream().map(KeywordGroupRequest::toKeywordGroup).toList();
    List<DateRange> dateRanges =
        request.dateRanges().stream().map(DateRangeRequest::toDateRange).toList();
    DateRange.requireUniqueLabels(dateRanges);
    YouTubeApi api = apiFactory.forAccessToken(request.accessToken());
    String channelId = request.channelId();

    String jobId =
        jobExecutor.executeJob(
            AGGREGATE_JOB,
            context ->
                aggregationService.aggregate(
                    api, channelId, groups, dateRanges, context::reportProgress));

    LOGGER.info(
        "Started aggregation job {}: channel={}, groups={}, ranges={}",
        jobId,
        channelId,
        groups.size(),
        dateRanges.size());
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  @PostMapping("/duration")
  @Operation(
      summary = "Start a report by video length",
      description =
          "Buckets every channel video by duration and aggregates each bucket's analytics for "
              + "each date range. Returns a job id to poll.")
  public ResponseEntity<AsyncJobResponse> analyzeDuration(
      @Valid @RequestBody DurationAnalysisRequest request) {
    List<DateRange> dateRanges =
        request.dateRanges().stream().map(DateRangeRequest::toDateRange).toList();
    DateRange.requireUniqueLabels(dateRanges);
    YouTubeApi api = apiFactory.forAccessToken(request.accessToken());
    String channelId = request.channelId();
    boolean ownChannel = request.ownChannel();

    String jobId =
        jobExecutor.executeJob(
            DURATION_JOB,
            context ->
                durationAnalysisService.analyze(
                    api, channelId, dateRanges, ownChannel, context::reportProgress));

    LOGGER.info("Started duration analysis job {}: channel={}", jobId, channelId);
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  @PostMapping("/clear-cache")
  @Operation(
      summary = "Clear cached report cells",
      description = "Forces the next report to query fresh analytics")
  public ResponseEntity<Map<String, Long>> clearCache() {
    return ResponseEntity.ok(Map.of("cleared", resultCache.clear()));
  }
}
