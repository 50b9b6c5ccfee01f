package com.dealfinder.checker.domain.detection;

public enum SuppressReason {
    LOW_CONFIDENCE,
    DUPLICATE
}
