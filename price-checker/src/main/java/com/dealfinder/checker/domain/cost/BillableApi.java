package com.dealfinder.checker.domain.cost;

public enum BillableApi {
    SEARCH,
    LLM_EXTRACTION
}
