package com.dealfinder.checker.infrastructure.llm;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/** JSON object the prompt asks the model to answer with. */
public record ExtractedPrice(
        BigDecimal price,
        String currency,
        @JsonProperty("candidate_prices") List<BigDecimal> candidatePrices) {}
