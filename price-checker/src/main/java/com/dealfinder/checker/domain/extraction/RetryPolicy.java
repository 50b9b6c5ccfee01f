package com.dealfinder.checker.domain.extraction;

import java.time.Duration;

public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {}
