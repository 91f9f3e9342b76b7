package com.scholary.channel.insights.client;

import java.time.Duration;

/**
 * How a job is polled.
 *
 * @param interval pause between polls
 * @param timeout give up once this much time has passed
 * @param listener notified when progress changes
 */
public record PollOptions(Duration interval, Duration timeout, ProgressListener listener) {

  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(2);
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(10);

  public PollOptions {
    if (interval == null || interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Poll interval must be positive");
    }
    if (timeout == null || timeout.isNegative()) {
      throw new IllegalArgumentException("Poll timeout cannot be negative");
    }
    listener = listener == null ? ProgressListener.NONE : listener;
  }

  public static PollOptions defaults() {
    return new PollOptions(DEFAULT_INTERVAL, DEFAULT_TIMEOUT, ProgressListener.NONE);
  }

  public PollOptions withListener(ProgressListener listener) {
    return new PollOptions(interval, timeout, listener);
  }
}
