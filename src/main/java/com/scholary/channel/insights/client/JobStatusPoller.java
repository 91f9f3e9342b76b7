package com.scholary.channel.insights.client;

import com.scholary.channel.insights.job.Job;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Waits for a job to finish by polling its status.
 *
 * <p>The poll ends with the job's result, or with one of three exceptions: {@link
 * JobFailedException} when the job failed, {@link JobNotFoundException} when the job is gone,
 * {@link JobTimeoutException} when the timeout elapses first. Timing out does not affect the job.
 */
public class JobStatusPoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStatusPoller.class);

  private final JobStatusSource source;

  public JobStatusPoller(JobStatusSource source) {
    this.source = source;
  }

  /** Poll with the default interval (2 s) and timeout (10 min). */
  public Object awaitResult(String jobId) throws InterruptedException {
    return awaitResult(jobId, PollOptions.defaults());
  }

  /**
   * Poll until the job reaches a terminal state.
   *
   * @return the job's result
   * @throws JobFailedException if the job failed
   * @throws JobNotFoundException if the job does not exist
   * @throws JobTimeoutException if the job is still running when the timeout elapses
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public Object awaitResult(String jobId, PollOptions options) throws InterruptedException {
    long deadline = System.nanoTime() + options.timeout().toNanos();
    Integer lastPercent = null;
    String lastMessage = null;

    while (true) {
      Optional<Job> current = source.fetch(jobId);
      if (current.isEmpty()) {
        LOGGER.debug("Job {} not found", jobId);
        throw new JobNotFoundException(jobId);
      }
      Job job = current.get();

      if (lastPercent == null
          || lastPercent != job.progressPercent()
          || !Objects.equals(lastMessage, job.progressMessage())) {
        lastPercent = job.progressPercent();
        lastMessage = job.progressMessage();
        options.listener().onProgress(job.progressPercent(), job.progressMessage());
      }

      switch (job.status()) {
        case COMPLETED:
          return job.result();
        case FAILED:
          throw new JobFailedException(jobId, job.error() != null ? job.error() : "Job failed");
        default:
          break;
      }

      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        throw new JobTimeoutException(jobId, options.timeout());
      }
      long remainingMs = Duration.ofNanos(remaining).toMillis() + 1;
      Thread.sleep(Math.min(options.interval().toMillis(), remainingMs));
    }
  }
}
