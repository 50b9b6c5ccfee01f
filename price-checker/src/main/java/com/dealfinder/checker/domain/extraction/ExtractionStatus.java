package com.dealfinder.checker.domain.extraction;

public enum ExtractionStatus {
    OBSERVED,
    FAILED,
    BUDGET_EXCEEDED
}
