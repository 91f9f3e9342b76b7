package com.scholary.channel.insights.job;

import com.scholary.channel.insights.logging.StructuredLogger;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs units of work in the background under the {@link JobRegistry} lifecycle.
 *
 * <p>Work is submitted to a bounded worker pool (see {@code AsyncConfig}), so the number of jobs
 * hitting the rate-limited provider at once is capped. The executor keeps a handle per in-flight
 * job; that is what makes {@link #runningJobIds()} and {@link #cancel(String)} possible.
 *
 * <p>Nothing thrown by a task escapes: every failure ends up as a {@code FAILED} job.
 */
@Service
public class JobExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobExecutor.class);

  private final JobRegistry registry;
  private final AsyncTaskExecutor taskExecutor;
  private final ConcurrentHashMap<String, RunningJob> running = new ConcurrentHashMap<>();

  public JobExecutor(
      JobRegistry registry, @Qualifier("jobTaskExecutor") AsyncTaskExecutor taskExecutor) {
    this.registry = registry;
    this.taskExecutor = taskExecutor;
  }

  /**
   * Create a job and schedule {@code task} for it.
   *
   * @param kind tag describing the work
   * @param task the work to run
   * @return the job id, returned before the task starts
   */
  public String executeJob(String kind, JobTask task) {
    String jobId = registry.createJob(kind);
    RunningJob handle = new RunningJob();
    running.put(jobId, handle);

    try {
      handle.future = taskExecutor.submit(() -> run(jobId, kind, task, handle));
    } catch (RejectedExecutionException e) {
      running.remove(jobId);
      LOGGER.warn("Job {} rejected, worker queue is full", jobId);
      registry.failJob(jobId, "Too many jobs in progress, try again later");
    }
    return jobId;
  }

  /**
   * Delete a job and stop its work if it is still running.
   *
   * @return true if a job record existed
   */
  public boolean cancel(String jobId) {
    RunningJob handle = running.remove(jobId);
    if (handle != null) {
      handle.cancelled = true;
      Future<?> future = handle.future;
      if (future != null) {
        future.cancel(true);
      }
      LOGGER.info("Cancellation requested for running job {}", jobId);
    }
    return registry.deleteJob(jobId);
  }

  /** Ids of jobs whose work has been submitted and has not finished yet. */
  public Set<String> runningJobIds() {
    return Set.copyOf(running.keySet());
  }

  private void run(String jobId, String kind, JobTask task, RunningJob handle) {
    StructuredLogger.setJobContext(jobId, kind);
    try {
      if (handle.cancelled) {
        return;
      }
      registry.markProcessing(jobId);
      JobContext context = new JobContext(jobId, kind, registry, () -> handle.cancelled);
      Object result = task.run(context);
      registry.completeJob(jobId, result);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      registry.failJob(jobId, "Job interrupted");
    } catch (CancellationException e) {
      LOGGER.info("Job {} ({}) stopped: {}", jobId, kind, e.getMessage());
      registry.failJob(jobId, messageOf(e));
    } catch (Exception e) {
      LOGGER.error("Job {} ({}) threw", jobId, kind, e);
      registry.failJob(jobId, messageOf(e));
    } catch (Error e) {
      LOGGER.error("Job {} ({}) died", jobId, kind, e);
      registry.failJob(jobId, messageOf(e));
      throw e;
    } finally {
      running.remove(jobId, handle);
      StructuredLogger.clearJobContext();
    }
  }

  private static String messageOf(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private static final class RunningJob {
    volatile Future<?> future;
    volatile boolean cancelled;
  }
}
