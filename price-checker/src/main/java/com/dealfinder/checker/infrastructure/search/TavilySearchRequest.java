package com.dealfinder.checker.infrastructure.search;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TavilySearchRequest(
        String query,
        @JsonProperty("max_results") int maxResults,
        @JsonProperty("search_depth") String searchDepth,
        @JsonProperty("include_answer") boolean includeAnswer) {}
