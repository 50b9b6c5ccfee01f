package com.dealfinder.checker.domain.extraction;

public interface PriceExtractionModel {

    ModelExtraction extract(String productName, String sourceText);
}
