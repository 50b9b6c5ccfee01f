package com.dealfinder.checker.domain.detection;

import java.math.BigDecimal;
import java.time.Duration;

public record DedupPolicy(Duration window, BigDecimal priceBucket, Duration pendingClaimTimeout) {}
