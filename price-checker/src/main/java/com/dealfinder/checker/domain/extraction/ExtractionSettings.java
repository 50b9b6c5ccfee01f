package com.dealfinder.checker.domain.extraction;

public record ExtractionSettings(int maxResults, int maxSourceChars) {}
