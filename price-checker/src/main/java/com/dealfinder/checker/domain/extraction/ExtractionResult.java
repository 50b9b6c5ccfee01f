package com.dealfinder.checker.domain.extraction;

import com.dealfinder.common.event.ErrorKind;

import java.math.BigDecimal;

/**
 * Outcome of one extraction. {@code spend} is what was committed to the budget for this product,
 * whatever the status.
 */
public record ExtractionResult(
        ExtractionStatus status,
        PriceObservation observation,
        ErrorKind errorKind,
        String reason,
        BigDecimal spend
) {

    public static ExtractionResult observed(PriceObservation observation, BigDecimal spend) {
        return new ExtractionResult(ExtractionStatus.OBSERVED, observation, null, null, spend);
    }

    public static ExtractionResult failed(ErrorKind errorKind, String reason, BigDecimal spend) {
        return new ExtractionResult(ExtractionStatus.FAILED, null, errorKind, reason, spend);
    }

    public static ExtractionResult budgetExceeded(String reason, BigDecimal spend) {
        return new ExtractionResult(
                ExtractionStatus.BUDGET_EXCEEDED, null, ErrorKind.BUDGET_EXCEEDED, reason, spend);
    }

    public boolean isObserved() {
        return status == ExtractionStatus.OBSERVED;
    }
}
