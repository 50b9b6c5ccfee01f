package com.dealfinder.checker.domain.extraction;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder(toBuilder = true)
public record PriceObservation(
        String productId,
        BigDecimal observedPrice,
        String currency,
        Confidence confidence,
        Instant observedAt
) {}
