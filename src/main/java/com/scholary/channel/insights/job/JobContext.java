package com.scholary.channel.insights.job;

import com.scholary.channel.insights.logging.StructuredLogger;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handle passed to a running {@link JobTask}. */
public final class JobContext {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobContext.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final String jobId;
  private final String kind;
  private final JobRegistry registry;
  private final BooleanSupplier cancelled;

  JobContext(String jobId, String kind, JobRegistry registry, BooleanSupplier cancelled) {
    this.jobId = jobId;
    this.kind = kind;
    this.registry = registry;
    this.cancelled = cancelled;
  }

  public String jobId() {
    return jobId;
  }

  public String kind() {
    return kind;
  }

  /**
   * Publish progress. Also a cancellation point: throws once the job has been cancelled.
   *
   * @throws CancellationException if the job was cancelled
   */
  public void reportProgress(int percent, String message) {
    throwIfCancelled();
    registry.updateProgress(jobId, percent, message);
    structuredLogger.logJobProgress(jobId, percent, message);
  }

  public boolean isCancelled() {
    return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
  }

  /** Stop the task between provider calls once the job has been cancelled. */
  public void throwIfCancelled() {
    if (isCancelled()) {
      throw new CancellationException("Job " + jobId + " was cancelled");
    }
  }
}
