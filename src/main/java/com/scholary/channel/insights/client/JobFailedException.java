package com.scholary.channel.insights.client;

/** The polled job ended in the failed state; the message is the job's error. */
public class JobFailedException extends RuntimeException {

  private final String jobId;

  public JobFailedException(String jobId, String error) {
    super(error);
    this.jobId = jobId;
  }

  public String jobId() {
    return jobId;
  }
}
