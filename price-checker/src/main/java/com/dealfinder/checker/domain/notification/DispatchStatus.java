package com.dealfinder.checker.domain.notification;

public enum DispatchStatus {
    SENT,
    PARTIALLY_FAILED,
    FAILED,
    SUPPRESSED
}
