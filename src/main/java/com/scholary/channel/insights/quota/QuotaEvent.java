package com.scholary.channel.insights.quota;

import java.time.Instant;
import java.util.Map;

/**
 * One provider call charged against the daily quota.
 *
 * @param action provider call name, e.g. {@code youtube.search.list}
 * @param units cost of the call
 * @param timestamp when the call was made
 * @param details free-form context (caller, page, date range...)
 */
public record QuotaEvent(
    String action, long units, Instant timestamp, Map<String, Object> details) {

  public QuotaEvent {
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
