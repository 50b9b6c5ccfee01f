package com.dealfinder.checker.domain.detection;

public enum DecisionType {
    NOTIFY,
    SUPPRESS,
    NO_CHANGE
}
