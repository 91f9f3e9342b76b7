package com.scholary.channel.insights.youtube;

import java.util.List;

/**
 * Result of a YouTube Analytics {@code reports.query}.
 *
 * @param columns metric names, in the order of the values in each row
 * @param rows data rows; empty when the provider has no data for the filter and date range
 */
public record AnalyticsReport(List<String> columns, List<List<Double>> rows) {

  public AnalyticsReport {
    columns = columns == null ? List.of() : List.copyOf(columns);
    rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
