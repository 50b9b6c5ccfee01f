package com.dealfinder.common.event;

public enum RunStatus {
    COMPLETED,
    CANCELLED,
    FAILED
}
