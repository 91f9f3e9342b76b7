package com.scholary.channel.insights.client;

import java.time.Duration;

/**
 * The polled job did not finish in time.
 *
 * <p>The job itself keeps running; its record is purged by retention once it finishes.
 */
public class JobTimeoutException extends RuntimeException {

  private final String jobId;

  public JobTimeoutException(String jobId, Duration timeout) {
    super("Job " + jobId + " did not finish within " + timeout);
    this.jobId = jobId;
  }

  public String jobId() {
    return jobId;
  }
}
