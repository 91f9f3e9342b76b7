package com.scholary.channel.insights.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.channel.insights.config.JobProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of jobs.
 *
 * <p>Uses a Caffeine cache with a per-entry expiry: pending and processing jobs never expire,
 * terminal jobs expire once the retention window has passed since they finished. The registry is
 * volatile; nothing survives a restart.
 *
 * <p>All mutations go through {@code asMap().computeIfPresent}, so each job is updated atomically
 * even when several worker threads report at once.
 */
@Repository
public class JobRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRegistry.class);

  private final Cache<String, Job> cache;
  private final Clock clock;

  public JobRegistry(JobProperties properties, Clock clock, Ticker ticker) {
    this.clock = clock;
    this.cache =
        Caffeine.newBuilder()
            .expireAfter(new RetentionExpiry(Duration.ofMinutes(properties.retentionMinutes())))
            .ticker(ticker)
            .build();
  }

  /** Insert a new pending job and return its id. */
  public String createJob(String kind) {
    String jobId = UUID.randomUUID().toString();
    cache.put(jobId, Job.pending(jobId, kind, clock.instant()));
    LOGGER.info("Job created: {} (kind: {})", jobId, kind);
    return jobId;
  }

  public void markProcessing(String jobId) {
    transition(
        jobId,
        "markProcessing",
        job -> {
          if (job.status() != JobStatus.PENDING) {
            LOGGER.warn("Job {} is {}, cannot mark processing", jobId, job.status());
            return job;
          }
          return job.processing(clock.instant());
        });
  }

  /** Overwrite progress fields. Only applies while the job is processing. */
  public void updateProgress(String jobId, int percent, String message) {
    transition(
        jobId,
        "updateProgress",
        job -> {
          if (job.status() != JobStatus.PROCESSING) {
            LOGGER.warn("Job {} is {}, ignoring progress update", jobId, job.status());
            return job;
          }
          return job.withProgress(percent, message, clock.instant());
        });
  }

  public void completeJob(String jobId, Object result) {
    transition(
        jobId,
        "completeJob",
        job -> {
          if (job.isTerminal()) {
            LOGGER.warn("Job {} is already {}, ignoring completion", jobId, job.status());
            return job;
          }
          LOGGER.info("Job {} completed", jobId);
          return job.completed(result, clock.instant());
        });
  }

  public void failJob(String jobId, String error) {
    transition(
        jobId,
        "failJob",
        job -> {
          if (job.isTerminal()) {
            LOGGER.warn("Job {} is already {}, ignoring failure: {}", jobId, job.status(), error);
            return job;
          }
          LOGGER.error("Job {} failed: {}", jobId, error);
          return job.failed(error, clock.instant());
        });
  }

  /**
   * Read a job snapshot.
   *
   * @return the job, or empty if it was never created or has been purged
   */
  public Optional<Job> getJob(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  /**
   * Remove a job record.
   *
   * @return true if a record was removed
   */
  public boolean deleteJob(String jobId) {
    boolean deleted = cache.asMap().remove(jobId) != null;
    if (deleted) {
      LOGGER.info("Job {} deleted", jobId);
    }
    return deleted;
  }

  /** Drop expired terminal jobs. Expired jobs are already invisible; this frees the memory. */
  @Scheduled(fixedDelayString = "${jobs.sweepIntervalMs:300000}")
  public void purgeExpired() {
    long before = cache.estimatedSize();
    cache.cleanUp();
    long purged = before - cache.estimatedSize();
    if (purged > 0) {
      LOGGER.info("Purged {} expired jobs", purged);
    }
  }

  private void transition(String jobId, String operation, UnaryOperator<Job> update) {
    Job updated = cache.asMap().computeIfPresent(jobId, (id, job) -> update.apply(job));
    if (updated == null) {
      LOGGER.warn("{}: job not found: {}", operation, jobId);
    }
  }

  /**
   * Keeps non-terminal jobs forever and terminal jobs for the retention window.
   *
   * <p>A terminal job keeps its remaining time on later no-op updates, so the window is measured
   * from the moment the job finished.
   */
  private static final class RetentionExpiry implements Expiry<String, Job> {

    private final long retentionNanos;

    RetentionExpiry(Duration retention) {
      this.retentionNanos = retention.toNanos();
    }

    @Override
    public long expireAfterCreate(String key, Job job, long currentTime) {
      return job.isTerminal() ? retentionNanos : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterUpdate(String key, Job job, long currentTime, long currentDuration) {
      return job.isTerminal() ? Math.min(currentDuration, retentionNanos) : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterRead(String key, Job job, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
