package com.scholary.channel.insights.analytics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One (row, date range) result. Either {@code metrics} or {@code error} is set.
 *
 * @param metrics combined metrics, null on failure
 * @param itemCount number of videos in the row
 * @param error failure message for this cell only
 * @param errorCode {@code QUOTA_EXCEEDED} or {@code PROVIDER_ERROR} on failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregationCell(MetricSet metrics, int itemCount, String error, String errorCode) {

  public static final String QUOTA_EXCEEDED = "QUOTA_EXCEEDED";
  public static final String PROVIDER_ERROR = "PROVIDER_ERROR";

  public static AggregationCell success(MetricSet metrics, int itemCount) {
    return new AggregationCell(metrics, itemCount, null, null);
  }

  public static AggregationCell failure(String error, String errorCode, int itemCount) {
    return new AggregationCell(null, itemCount, error, errorCode);
  }

  @JsonIgnore
  public boolean isFailed() {
    return error != null;
  }
}
