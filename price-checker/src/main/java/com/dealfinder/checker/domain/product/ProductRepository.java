package com.dealfinder.checker.domain.product;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Tracked products and their price baseline. Rows are created elsewhere; a price check only moves
 * {@code last_known_price} and {@code last_checked_at}.
 */
public interface ProductRepository {

    List<TrackedProduct> listTrackedProducts();

    void updatePrice(String productId, BigDecimal price, Instant checkedAt);

    /** Touches {@code last_checked_at} and leaves the baseline price alone. */
    void markChecked(String productId, Instant checkedAt);
}
