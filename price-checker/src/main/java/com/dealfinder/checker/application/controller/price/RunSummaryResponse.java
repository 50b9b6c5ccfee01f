package com.dealfinder.checker.application.controller.price;

import com.dealfinder.common.event.RunStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record RunSummaryResponse(
        String runId,
        RunStatus status,
        Instant startedAt,
        Instant finishedAt,
        int productsProcessed,
        int notified,
        int suppressed,
        int noChange,
        int extractionFailed,
        int budgetSkipped,
        int failed,
        BigDecimal totalSpend,
        BigDecimal remainingBudget,
        List<ProductOutcomeResponse> outcomes) {}
