package com.dealfinder.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/** Published once per finished run; the report generator renders it. */
@Builder(toBuilder = true)
public record PriceCheckRunCompleted(
        @JsonProperty("run_id") String runId,
        RunStatus status,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("products_processed") int productsProcessed,
        int notified,
        int suppressed,
        @JsonProperty("no_change") int noChange,
        @JsonProperty("extraction_failed") int extractionFailed,
        @JsonProperty("budget_skipped") int budgetSkipped,
        int failed,
        @JsonProperty("total_spend") BigDecimal totalSpend,
        @JsonProperty("remaining_budget") BigDecimal remainingBudget,
        List<ProductOutcomeEvent> outcomes) {}
