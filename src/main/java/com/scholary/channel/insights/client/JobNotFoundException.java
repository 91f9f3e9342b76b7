package com.scholary.channel.insights.client;

/** The polled job does not exist: it was never created, was deleted, or has been purged. */
public class JobNotFoundException extends RuntimeException {

  private final String jobId;

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
    this.jobId = jobId;
  }

  public String jobId() {
    return jobId;
  }
}
