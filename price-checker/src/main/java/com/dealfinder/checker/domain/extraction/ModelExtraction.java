package com.dealfinder.checker.domain.extraction;

import java.math.BigDecimal;
import java.util.List;

/**
 * What the language model read out of the sources.
 *
 * @param price      the current selling price, or null when none was found
 * @param candidates every distinct current selling price the model saw for the product
 * @param cost       cost of the call computed from token usage, or null if unknown
 */
public record ModelExtraction(BigDecimal price, String currency, List<BigDecimal> candidates, BigDecimal cost) {

    public static ModelExtraction empty(BigDecimal cost) {
        return new ModelExtraction(null, null, List.of(), cost);
    }
}
