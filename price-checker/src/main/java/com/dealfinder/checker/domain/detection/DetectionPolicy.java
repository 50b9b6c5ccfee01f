package com.dealfinder.checker.domain.detection;

import java.math.BigDecimal;

/** @param volatilityThreshold relative move (0.10 = 10%) a LOW-confidence price may make before it is distrusted */
public record DetectionPolicy(BigDecimal volatilityThreshold) {}
