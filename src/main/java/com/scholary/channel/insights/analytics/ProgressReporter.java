package com.scholary.channel.insights.analytics;

/** Receives progress from long-running analytics work. */
@FunctionalInterface
public interface ProgressReporter {

  ProgressReporter NONE = (percent, message) -> {};

  void report(int percent, String message);
}
