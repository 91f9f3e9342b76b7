package com.scholary.channel.insights.job;

/** A unit of work run under the {@link JobExecutor}. */
@FunctionalInterface
public interface JobTask {

  /**
   * Run the work.
   *
   * @param context job id, progress reporting and cancellation checks
   * @return the payload stored as the job result
   * @throws Exception any failure; the executor records its message as the job error
   */
  Object run(JobContext context) throws Exception;
}
