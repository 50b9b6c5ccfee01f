package com.dealfinder.checker.domain.extraction;

import java.math.BigDecimal;
import java.util.List;

/** @param cost actual cost reported for the call, or null when the provider bills a flat rate */
public record SearchResponse(List<SearchHit> hits, BigDecimal cost) {}
