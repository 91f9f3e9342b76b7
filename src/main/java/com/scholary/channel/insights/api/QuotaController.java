package com.scholary.channel.insights.api;

import com.scholary.channel.insights.quota.QuotaLedger;
import com.scholary.channel.insights.quota.QuotaSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST API for the server-side quota ledger. */
@RestController
@RequestMapping("/api/quota/server")
@Tag(name = "Quota", description = "YouTube API units spent by this process")
public class QuotaController {

  private final QuotaLedger quotaLedger;

  public QuotaController(QuotaLedger quotaLedger) {
    this.quotaLedger = quotaLedger;
  }

  @GetMapping
  @Operation(summary = "Quota snapshot", description = "Per-call totals, events and grand total")
  public QuotaSnapshot snapshot() {
    return quotaLedger.snapshot();
  }

  @PostMapping("/reset")
  @Operation(summary = "Reset quota ledger", description = "Clears totals and events")
  public QuotaSnapshot reset() {
    quotaLedger.reset();
    return quotaLedger.snapshot();
  }
}
