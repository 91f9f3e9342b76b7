package com.scholary.channel.insights.client;

/** Called by the poller when a job's progress changes. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (percent, message) -> {};

  void onProgress(int percent, String message);
}
