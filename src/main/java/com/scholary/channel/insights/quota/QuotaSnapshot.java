package com.scholary.channel.insights.quota;

import java.util.List;
import java.util.Map;

/** Point-in-time copy of the quota ledger. */
public record QuotaSnapshot(Map<String, Long> totals, List<QuotaEvent> events, long totalUnits) {}
