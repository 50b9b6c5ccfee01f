package com.dealfinder.checker.infrastructure.search;

import java.util.List;

public record TavilySearchResponse(List<Result> results) {

    public record Result(String url, String title, String content) {}
}
