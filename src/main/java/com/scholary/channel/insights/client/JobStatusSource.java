package com.scholary.channel.insights.client;

import com.scholary.channel.insights.job.Job;
import java.util.Optional;

/** Where a {@link JobStatusPoller} reads job snapshots from. */
public interface JobStatusSource {

  /**
   * Read the current snapshot of a job.
   *
   * @return the job, or empty if it does not exist (never created or purged)
   */
  Optional<Job> fetch(String jobId);
}
