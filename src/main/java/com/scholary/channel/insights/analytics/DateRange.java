package com.scholary.channel.insights.analytics;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A labelled, inclusive date range used as one column of an aggregation report.
 *
 * <p>Analytics are summed over the range, not over the video's lifetime.
 */
public record DateRange(String label, LocalDate startDate, LocalDate endDate) {

  public DateRange {
    if (label == null || label.isBlank()) {
      throw new IllegalArgumentException("Date range label is required");
    }
    if (startDate == null || endDate == null) {
      throw new IllegalArgumentException("Date range '" + label + "' needs a start and end date");
    }
    if (endDate.isBefore(startDate)) {
      throw new IllegalArgumentException(
          "Date range '" + label + "': end date must be >= start date");
    }
  }

  /**
   * Check that labels can serve as column keys.
   *
   * @throws IllegalArgumentException if two ranges share a label
   */
  public static void requireUniqueLabels(List<DateRange> dateRanges) {
    Set<String> seen = new HashSet<>();
    for (DateRange range : dateRanges) {
      if (!seen.add(range.label())) {
        throw new IllegalArgumentException("Duplicate date range label: " + range.label());
      }
    }
  }
}
