package com.scholary.channel.insights.analytics;

import java.util.List;

/**
 * Metric values for one set of videos over one date range.
 *
 * <p>Averages are in seconds ({@code averageViewDuration}) and percent ({@code
 * averageViewPercentage}).
 */
public record MetricSet(
    long views,
    double estimatedMinutesWatched,
    double averageViewDuration,
    double averageViewPercentage,
    long likes,
    long comments,
    long shares,
    long subscribersGained) {

  private static final MetricSet ZERO = new MetricSet(0, 0, 0, 0, 0, 0, 0, 0);

  public static MetricSet zero() {
    return ZERO;
  }

  /**
   * Build a metric set from one report row.
   *
   * @param columns metric names of the report, matching {@code values} by position
   * @param values row values; missing metrics read as 0
   */
  public static MetricSet fromRow(List<String> columns, List<Double> values) {
    return new MetricSet(
        Math.round(value(columns, values, Metric.VIEWS)),
        value(columns, values, Metric.ESTIMATED_MINUTES_WATCHED),
        value(columns, values, Metric.AVERAGE_VIEW_DURATION),
        value(columns, values, Metric.AVERAGE_VIEW_PERCENTAGE),
        Math.round(value(columns, values, Metric.LIKES)),
        Math.round(value(columns, values, Metric.COMMENTS)),
        Math.round(value(columns, values, Metric.SHARES)),
        Math.round(value(columns, values, Metric.SUBSCRIBERS_GAINED)));
  }

  private static double value(List<String> columns, List<Double> values, Metric metric) {
    int index = columns.indexOf(metric.apiName());
    if (index < 0 || index >= values.size() || values.get(index) == null) {
      return 0;
    }
    return values.get(index);
  }
}
