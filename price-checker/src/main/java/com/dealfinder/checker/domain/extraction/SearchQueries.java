package com.dealfinder.checker.domain.extraction;

import com.dealfinder.checker.domain.product.TrackedProduct;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.regex.Pattern;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SearchQueries {

    static final int MAX_QUERY_LENGTH = 200;

    private static final Pattern CONTROL = Pattern.compile("\\p{Cntrl}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * The product URL when one is tracked, otherwise {@code "<query> price"} with the free text
     * cleaned by {@link ProductInputGuard#sanitize}.
     */
    public static String forProduct(TrackedProduct product) {
        if (product.url() != null && !product.url().isBlank()) {
            return sanitize(product.url());
        }
        var base = product.searchQuery() != null && !product.searchQuery().isBlank()
                ? product.searchQuery()
                : product.name();
        return sanitize(ProductInputGuard.sanitize(base) + " price");
    }

    static String sanitize(String raw) {
        var cleaned = CONTROL.matcher(raw).replaceAll(" ");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
        return cleaned.length() > MAX_QUERY_LENGTH ? cleaned.substring(0, MAX_QUERY_LENGTH).strip() : cleaned;
    }
}
