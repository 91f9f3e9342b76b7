package com.scholary.channel.insights.client;

/** Exception thrown when the job status endpoint cannot be read. */
public class JobStatusClientException extends RuntimeException {

  public JobStatusClientException(String message) {
    super(message);
  }

  public JobStatusClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
