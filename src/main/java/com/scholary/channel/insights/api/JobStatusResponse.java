package com.scholary.channel.insights.api;

import com.scholary.channel.insights.job.Job;
import com.scholary.channel.insights.job.JobStatus;
import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job; {@code result} is set once it has completed and
 * {@code error} once it has failed.
 */
public record JobStatusResponse(
    String id,
    String kind,
    JobStatus status,
    int progressPercent,
    String progressMessage,
    Object result,
    String error,
    Instant createdAt,
    Instant updatedAt) {

  public static JobStatusResponse from(Job job) {
    return new JobStatusResponse(
        job.id(),
        job.kind(),
        job.status(),
        job.progressPercent(),
        job.progressMessage(),
        job.result(),
        job.error(),
        job.createdAt(),
        job.updatedAt());
  }
}
