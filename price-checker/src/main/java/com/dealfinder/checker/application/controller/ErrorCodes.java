package com.dealfinder.checker.application.controller;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorCodes {

    public static final String RUN_IN_PROGRESS = "RUN_IN_PROGRESS";
    public static final String RUN_FAILED = "RUN_FAILED";
    public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
