package com.scholary.channel.insights.analytics;

import java.util.Arrays;
import java.util.List;

/** The metrics requested for every aggregation cell, in query order. */
public enum Metric {
  VIEWS("views"),
  ESTIMATED_MINUTES_WATCHED("estimatedMinutesWatched"),
  AVERAGE_VIEW_DURATION("averageViewDuration"),
  AVERAGE_VIEW_PERCENTAGE("averageViewPercentage"),
  LIKES("likes"),
  COMMENTS("comments"),
  SHARES("shares"),
  SUBSCRIBERS_GAINED("subscribersGained");

  private final String apiName;

  Metric(String apiName) {
    this.apiName = apiName;
  }

  public String apiName() {
    return apiName;
  }

  public static List<String> apiNames() {
    return Arrays.stream(values()).map(Metric::apiName).toList();
  }
}
