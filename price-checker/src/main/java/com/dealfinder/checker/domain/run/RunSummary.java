package com.dealfinder.checker.domain.run;

import com.dealfinder.common.event.OutcomeKind;
import com.dealfinder.common.event.RunStatus;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Builder(toBuilder = true)
public record RunSummary(
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
        List<ProductOutcome> outcomes
) {

    /**
     * Counts outcomes by kind. Every product with an outcome counts as processed, cancelled ones
     * included, so the per-kind counts add up to {@code productsProcessed}. Dispatch, persistence,
     * unexpected and cancelled outcomes count as failed.
     */
    public static RunSummary of(
            String runId,
            RunStatus status,
            Instant startedAt,
            Instant finishedAt,
            List<ProductOutcome> outcomes,
            BigDecimal remainingBudget) {
        return RunSummary.builder()
                .runId(runId)
                .status(status)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .productsProcessed(outcomes.size())
                .notified(count(outcomes, OutcomeKind.NOTIFIED))
                .suppressed(count(outcomes, OutcomeKind.SUPPRESSED))
                .noChange(count(outcomes, OutcomeKind.NO_CHANGE))
                .extractionFailed(count(outcomes, OutcomeKind.EXTRACTION_FAILED))
                .budgetSkipped(count(outcomes, OutcomeKind.BUDGET_SKIPPED))
                .failed(count(outcomes, OutcomeKind.DISPATCH_FAILED)
                        + count(outcomes, OutcomeKind.PERSISTENCE_FAILED)
                        + count(outcomes, OutcomeKind.ERROR)
                        + count(outcomes, OutcomeKind.CANCELLED))
                .totalSpend(outcomes.stream()
                        .map(ProductOutcome::spend)
                        .filter(s -> s != null)
                        .reduce(BigDecimal.ZERO, BigDecimal::add))
                .remainingBudget(remainingBudget)
                .outcomes(List.copyOf(outcomes))
                .build();
    }

    private static int count(List<ProductOutcome> outcomes, OutcomeKind kind) {
        return (int) outcomes.stream().filter(o -> o.kind() == kind).count();
    }
}
