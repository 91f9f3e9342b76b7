package com.scholary.channel.insights.api;

import com.scholary.channel.insights.analytics.DateRange;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

/** A report column: label plus inclusive {@code YYYY-MM-DD} dates. */
public record DateRangeRequest(
    @NotBlank String label, @NotNull LocalDate startDate, @NotNull LocalDate endDate) {

  DateRange toDateRange() {
    return new DateRange(label, startDate, endDate);
  }
}
