package com.dealfinder.checker.domain.notification;

public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED
}
