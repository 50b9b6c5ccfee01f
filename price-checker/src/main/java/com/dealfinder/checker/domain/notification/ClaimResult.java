package com.dealfinder.checker.domain.notification;

public enum ClaimResult {
    CLAIMED,
    ALREADY_EXISTS
}
