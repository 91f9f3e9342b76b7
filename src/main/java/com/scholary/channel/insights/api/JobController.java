package com.scholary.channel.insights.api;

import com.scholary.channel.insights.job.JobExecutor;
import com.scholary.channel.insights.job.JobRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST API for background job status. */
@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "Status and cancellation of background jobs")
public class JobController {

  private final JobRegistry registry;
  private final JobExecutor executor;

  public JobController(JobRegistry registry, JobExecutor executor) {
    this.registry = registry;
    this.executor = executor;
  }

  /**
   * Get job status.
   *
   * <p>Unknown ids and jobs past their retention window both answer 404.
   */
  @GetMapping("/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a background job")
  public ResponseEntity<?> getJob(@PathVariable String id) {
    return registry
        .getJob(id)
        .<ResponseEntity<?>>map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
        .orElseGet(() -> notFound(id));
  }

  @DeleteMapping("/{id}")
  @Operation(
      summary = "Cancel a job",
      description = "Deletes the job record and interrupts its work if it is still running")
  public ResponseEntity<?> cancelJob(@PathVariable String id) {
    if (!executor.cancel(id)) {
      return notFound(id);
    }
    return ResponseEntity.ok(Map.of("id", id, "deleted", true));
  }

  @GetMapping
  @Operation(summary = "List running jobs", description = "Ids of jobs whose work has not finished")
  public Map<String, Set<String>> runningJobs() {
    return Map.of("running", executor.runningJobIds());
  }

  private static ResponseEntity<?> notFound(String id) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ErrorResponse("Job not found", id));
  }
}
