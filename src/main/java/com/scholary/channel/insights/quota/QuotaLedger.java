package com.scholary.channel.insights.quota;

import com.scholary.channel.insights.logging.StructuredLogger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide record of quota units spent on provider calls.
 *
 * <p>Every call site in discovery and aggregation records here. The ledger only observes; it never
 * blocks or rejects a call.
 */
@Component
public class QuotaLedger {

  private static final Logger LOGGER = LoggerFactory.getLogger(QuotaLedger.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final Clock clock;
  private final Map<String, Long> totals = new LinkedHashMap<>();
  private final List<QuotaEvent> events = new ArrayList<>();

  public QuotaLedger(Clock clock) {
    this.clock = clock;
  }

  /**
   * Record a provider call.
   *
   * @param action provider call name
   * @param units cost of the call; non-positive values are ignored
   * @param details free-form context
   */
  public void record(String action, long units, Map<String, Object> details) {
    if (units <= 0) {
      return;
    }
    synchronized (this) {
      totals.merge(action, units, Long::sum);
      events.add(new QuotaEvent(action, units, clock.instant(), details));
    }
    structuredLogger.logQuotaConsumed(action, units, details);
  }

  public synchronized QuotaSnapshot snapshot() {
    long totalUnits = totals.values().stream().mapToLong(Long::longValue).sum();
    return new QuotaSnapshot(
        Collections.unmodifiableMap(new LinkedHashMap<>(totals)), List.copyOf(events), totalUnits);
  }

  public synchronized void reset() {
    totals.clear();
    events.clear();
    LOGGER.info("Quota ledger reset");
  }
}
