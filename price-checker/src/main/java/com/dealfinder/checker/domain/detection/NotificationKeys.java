package com.dealfinder.checker.domain.detection;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Deterministic notification ids: {@code <product_id>:<price bucket floor>:<window index>}.
 * Windows are fixed epoch-aligned slices of the dedup window length, so two runs that observe the
 * same drop inside one window compute the same id.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class NotificationKeys {

    public static String of(String productId, BigDecimal price, Instant observedAt, DedupPolicy policy) {
        var bucket = policy.priceBucket();
        var floor = price.divide(bucket, 0, RoundingMode.FLOOR).multiply(bucket);
        long window = observedAt.getEpochSecond() / policy.window().toSeconds();
        return productId + ":" + floor.stripTrailingZeros().toPlainString() + ":" + window;
    }
}
