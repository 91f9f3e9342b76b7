package com.scholary.channel.insights.logging;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts an {@code event_type} plus its own fields into the MDC for the duration of a
 * single log statement, so log shippers can index them without parsing the message.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log quota consumption for one provider call. */
  public void logQuotaConsumed(String action, long units, Map<String, Object> details) {
    try {
      MDC.put("event_type", "quota_consumed");
      MDC.put("action", action);
      MDC.put("units", String.valueOf(units));

      logger.debug(
          "Quota consumed: +{} units via {} {}",
          units,
          action,
          details == null || details.isEmpty() ? "" : details);
    } finally {
      clearEventFields();
    }
  }

  /** Log a switch from targeted search to full enumeration. */
  public void logDiscoveryFallback(String channelId, String keyword, String reason) {
    try {
      MDC.put("event_type", "discovery_fallback");
      MDC.put("channelId", channelId);
      MDC.put("keyword", keyword);

      logger.info(
          "Discovery fallback: channel={}, keyword=\"{}\", reason={}", channelId, keyword, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log that enumeration stopped at the page ceiling. */
  public void logPageCeilingReached(String channelId, int pages, int itemsSoFar) {
    try {
      MDC.put("event_type", "page_ceiling_reached");
      MDC.put("channelId", channelId);
      MDC.put("pages", String.valueOf(pages));

      logger.warn(
          "Page ceiling reached: channel={}, pages={}, items={}; narrow the keyword or split the"
              + " query",
          channelId,
          pages,
          itemsSoFar);
    } finally {
      clearEventFields();
    }
  }

  /** Log one resolved aggregation cell. */
  public void logCellResolved(String group, String range, boolean cached, int itemCount) {
    try {
      MDC.put("event_type", "cell_resolved");
      MDC.put("group", group);
      MDC.put("range", range);
      MDC.put("cached", String.valueOf(cached));

      logger.debug(
          "Cell resolved: group={}, range={}, cached={}, items={}",
          group,
          range,
          cached,
          itemCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log one failed aggregation cell. */
  public void logCellFailed(String group, String range, String errorCode, String message) {
    try {
      MDC.put("event_type", "cell_failed");
      MDC.put("group", group);
      MDC.put("range", range);
      MDC.put("errorCode", errorCode);

      logger.warn(
          "Cell failed: group={}, range={}, code={}, message={}",
          group,
          range,
          errorCode,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int percentComplete, String message) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info("Job progress: jobId={}, progress={}%, {}", jobId, percentComplete, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String kind) {
    MDC.put("jobId", jobId);
    MDC.put("jobKind", kind);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("jobKind");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("action");
    MDC.remove("units");
    MDC.remove("channelId");
    MDC.remove("keyword");
    MDC.remove("pages");
    MDC.remove("group");
    MDC.remove("range");
    MDC.remove("cached");
    MDC.remove("errorCode");
    MDC.remove("percentComplete");
  }
}
