package com.scholary.channel.insights.youtube;

/** The provider refused a call because the daily quota or a rate limit was exhausted. */
public class QuotaExceededException extends YouTubeApiException {

  public QuotaExceededException(int status, String message) {
    super(status, message);
  }
}
