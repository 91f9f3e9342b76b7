package com.scholary.channel.insights.analytics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A metrics matrix: one row per group, one column per date range.
 *
 * @param rows rows in request order
 * @param columns date-range labels in request order
 * @param summary context for the whole report, such as channel country and per-row counts
 */
public record AggregationReport(
    List<AggregationRow> rows, List<String> columns, Map<String, Object> summary) {

  public AggregationReport {
    rows = List.copyOf(rows);
    columns = List.copyOf(columns);
    summary = Collections.unmodifiableMap(new LinkedHashMap<>(summary));
  }
}
