package com.dealfinder.common.event;

public enum ErrorKind {
    TRANSIENT_IO,
    BUDGET_EXCEEDED,
    EXTRACTION_FAILED,
    DUPLICATE_NOTIFICATION,
    PERSISTENCE_ERROR,
    CHANNEL_DELIVERY,
    CANCELLED,
    UNEXPECTED
}
