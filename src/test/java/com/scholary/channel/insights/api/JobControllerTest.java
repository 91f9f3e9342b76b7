package com.scholary.channel.insights.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.channel.insights.job.Job;
import com.scholary.channel.insights.job.JobExecutor;
import com.scholary.channel.insights.job.JobRegistry;
import com.scholary.channel.insights.job.JobStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(JobController.class)
class JobControllerTest {

  private static final Instant CREATED = Instant.parse("2024-07-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockBean private JobRegistry registry;
  @MockBean private JobExecutor executor;

  @Test
  void getJob_shouldReturnCompletedJobWithResult() throws Exception {
    Job job =
        new Job(
            "job-1",
            "channel-aggregate",
            JobStatus.COMPLETED,
            100,
            "Completed",
            Map.of("columns", List.of("May")),
            null,
            CREATED,
            CREATED.plusSeconds(30));
    when(registry.getJob("job-1")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("job-1"))
        .andExpect(jsonPath("$.status").value("completed"))
        .andExpect(jsonPath("$.progressPercent").value(100))
        .andExpect(jsonPath("$.result.columns[0]").value("May"));
  }

  @Test
  void getJob_shouldReturnFailedJobWithError() throws Exception {
    Job job =
        new Job(
            "job-2",
            "duration-analysis",
            JobStatus.FAILED,
            30,
            "Failed",
            null,
            "Channel not found: UC1",
            CREATED,
            CREATED);
    when(registry.getJob("job-2")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/jobs/job-2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("failed"))
        .andExpect(jsonPath("$.error").value("Channel not found: UC1"));
  }

  @Test
  void getJob_shouldReturnNotFoundForUnknownId() throws Exception {
    when(registry.getJob("missing")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/jobs/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Job not found"))
        .andExpect(jsonPath("$.details").value("missing"));
  }

  @Test
  void cancelJob_shouldDeleteKnownJob() throws Exception {
    when(executor.cancel("job-1")).thenReturn(true);

    mockMvc
        .perform(delete("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted").value(true));
  }

  @Test
  void cancelJob_shouldReturnNotFoundForUnknownJob() throws Exception {
    when(executor.cancel("missing")).thenReturn(false);

    mockMvc.perform(delete("/api/jobs/missing")).andExpect(status().isNotFound());
  }

  @Test
  void runningJobs_shouldListExecutorJobs() throws Exception {
    when(executor.runningJobIds()).thenReturn(Set.of("job-7"));

    mockMvc
        .perform(get("/api/jobs"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.running[0]").value("job-7"));
  }
}
