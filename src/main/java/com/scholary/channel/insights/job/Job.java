package com.scholary.channel.insights.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/**
 * Immutable snapshot of a job.
 *
 * <p>The registry replaces the stored snapshot on every transition, so a {@code Job} handed to a
 * caller never changes underneath it.
 *
 * @param id opaque unique identifier
 * @param kind caller-supplied tag describing the work
 * @param status lifecycle state
 * @param progressPercent 0-100
 * @param progressMessage latest human-readable status line
 * @param result payload, only set when completed
 * @param error message, only set when failed
 * @param createdAt creation time
 * @param updatedAt time of the last transition or progress update
 */
public record Job(
    String id,
    String kind,
    JobStatus status,
    int progressPercent,
    String progressMessage,
    Object result,
    String error,
    Instant createdAt,
    Instant updatedAt) {

  static Job pending(String id, String kind, Instant now) {
    return new Job(id, kind, JobStatus.PENDING, 0, "Job created", null, null, now, now);
  }

  Job processing(Instant now) {
    return new Job(
        id, kind, JobStatus.PROCESSING, progressPercent, "Processing", null, null, createdAt, now);
  }

  Job withProgress(int percent, String message, Instant now) {
    return new Job(id, kind, status, percent, message, null, null, createdAt, now);
  }

  Job completed(Object payload, Instant now) {
    return new Job(id, kind, JobStatus.COMPLETED, 100, "Completed", payload, null, createdAt, now);
  }

  Job failed(String message, Instant now) {
    return new Job(
        id, kind, JobStatus.FAILED, progressPercent, "Failed", null, message, createdAt, now);
  }

  @JsonIgnore
  public boolean isTerminal() {
    return status.isTerminal();
  }
}
