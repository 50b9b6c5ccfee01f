package com.dealfinder.checker.domain.extraction;

public enum Confidence {
    HIGH,
    LOW,
    UNKNOWN
}
