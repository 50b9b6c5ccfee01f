package com.dealfinder.checker.domain.notification;

public enum Channel {
    EMAIL,
    SMS
}
