package com.scholary.channel.insights.youtube;

/**
 * Exception thrown when a YouTube API call fails.
 *
 * <p>Carries the HTTP status when the provider answered; 0 means no response was received.
 */
public class YouTubeApiException extends RuntimeException {

  private final int status;

  public YouTubeApiException(int status, String message) {
    super(message);
    this.status = status;
  }

  public YouTubeApiException(String message, Throwable cause) {
    super(message, cause);
    this.status = 0;
  }

  public int status() {
    return status;
  }
}
