package com.scholary.channel.insights.analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One report row.
 *
 * @param name row label
 * @param keyword keyword of the row, null for rows that are not keyword based
 * @param itemCount videos in the row
 * @param cells cell per date-range label, in column order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregationRow(
    String name, String keyword, int itemCount, Map<String, AggregationCell> cells) {

  public AggregationRow {
    cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
  }
}
