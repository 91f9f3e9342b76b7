package com.scholary.channel.insights.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.channel.insights.analytics.ChannelAggregationService;
import com.scholary.channel.insights.analytics.DurationAnalysisService;
import com.scholary.channel.insights.cache.AnalyticsResultCache;
import com.scholary.channel.insights.job.JobExecutor;
import com.scholary.channel.insights.youtube.YouTubeApi;
import com.scholary.channel.insights.youtube.YouTubeApiFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ChannelAnalyticsController.class)
class ChannelAnalyticsControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private JobExecutor jobExecutor;
  @MockBean private YouTubeApiFactory apiFactory;
  @MockBean private ChannelAggregationService aggregationService;
  @MockBean private DurationAnalysisService durationAnalysisService;
  @MockBean private AnalyticsResultCache resultCache;
  private final YouTubeApi api = mock(YouTubeApi.class);

  @Test
  void aggregate_shouldStartJobAndReturnAccepted() throws Exception {
    when(apiFactory.forAccessToken("token")).thenReturn(api);
    when(jobExecutor.executeJob(eq(ChannelAnalyticsController.AGGREGATE_JOB), any()))
        .thenReturn("job-1");

    mockMvc
        .perform(
            post("/api/channel-analytics/aggregate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"accessToken": "token", "channelId": "UC1",
                     "keywordGroups": [{"name": "Bread", "keyword": "bread"},
                                       {"name": "All"}],
                     "dateRanges": [
                       {"label": "May", "startDate": "2024-05-01", "endDate": "2024-05-31"}]}
                    """))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-1"));
  }

  @Test
  void aggregate_shouldRejectMissingFields() throws Exception {
    mockMvc
        .perform(
            post("/api/channel-analytics/aggregate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"channelId": "UC1", "keywordGroups": [], "dateRanges": []}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Validation failed"));

    verify(jobExecutor, never()).executeJob(anyString(), any());
  }

  @Test
  void aggregate_shouldRejectDuplicateRangeLabelsBeforeStartingJob() throws Exception {
    mockMvc
        .perform(
            post("/api/channel-analytics/aggregate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"accessToken": "token", "channelId": "UC1",
                     "keywordGroups": [{"name": "All"}],
                     "dateRanges": [
                       {"label": "Q", "startDate": "2024-01-01", "endDate": "2024-03-31"},
                       {"label": "Q", "startDate": "2024-04-01", "endDate": "2024-06-30"}]}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid request"));

    verify(jobExecutor, never()).executeJob(anyString(), any());
  }

  @Test
  void aggregate_shouldRejectBackwardsRange() throws Exception {
    mockMvc
        .perform(
            post("/api/channel-analytics/aggregate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"accessToken": "token", "channelId": "UC1",
                     "keywordGroups": [{"name": "All"}],
                     "dateRanges": [
                       {"label": "Q", "startDate": "2024-03-31", "endDate": "2024-01-01"}]}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.details").value("Date range 'Q': end date must be >= start date"));
  }

  @Test
  void analyzeDuration_shouldStartJobAndReturnAccepted() throws Exception {
    when(apiFactory.forAccessToken("token")).thenReturn(api);
    when(jobExecutor.executeJob(eq(ChannelAnalyticsController.DURATION_JOB), any()))
        .thenReturn("job-2");

    mockMvc
        .perform(
            post("/api/channel-analytics/duration")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"accessToken": "token", "channelId": "UC1", "ownChannel": false,
                     "dateRanges": [
                       {"label": "2024", "startDate": "2024-01-01", "endDate": "2024-12-31"}]}
                    """))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-2"));
  }

  @Test
  void clearCache_shouldReturnClearedCount() throws Exception {
    when(resultCache.clear()).thenReturn(3L);

    mockMvc
        .perform(post("/api/channel-analytics/clear-cache"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cleared").value(3));
  }
}
