package com.dealfinder.common.event;

/** What happened to a single product during a run. */
public enum OutcomeKind {
    NOTIFIED,
    SUPPRESSED,
    NO_CHANGE,
    EXTRACTION_FAILED,
    BUDGET_SKIPPED,
    DISPATCH_FAILED,
    PERSISTENCE_FAILED,
    ERROR,
    CANCELLED
}
