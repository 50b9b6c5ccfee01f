package com.dealfinder.checker.domain.product;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder(toBuilder = true)
public record TrackedProduct(
        String productId,
        String name,
        String searchQuery,
        String url,
        BigDecimal targetPrice,
        String currency,
        BigDecimal lastKnownPrice,
        Instant lastCheckedAt,
        String subscriberEmail,
        String subscriberPhone,
        Instant createdAt
) {

    public boolean hasBaseline() {
        return lastKnownPrice != null;
    }
}
