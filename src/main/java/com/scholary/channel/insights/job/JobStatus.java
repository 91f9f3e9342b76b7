package com.scholary.channel.insights.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle state of a job.
 *
 * <p>{@code PENDING -> PROCESSING -> COMPLETED | FAILED}. Both terminal states are absorbing.
 */
public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobStatus fromWireValue(String value) {
    return JobStatus.valueOf(value.toUpperCase(Locale.ROOT));
  }
}
