package com.dealfinder.checker.domain.extraction;

public record SearchHit(String url, String title, String content) {}
