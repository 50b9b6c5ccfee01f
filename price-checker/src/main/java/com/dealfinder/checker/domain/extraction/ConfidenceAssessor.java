package com.dealfinder.checker.domain.extraction;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Component
public class ConfidenceAssessor {

    /**
     * UNKNOWN when no positive price was read. LOW when the currency is not the expected one, when
     * the model saw more than one distinct selling price, or when the price is not written anywhere
     * in the source text. HIGH otherwise.
     */
    public Confidence assess(ModelExtraction extraction, String expectedCurrency, List<BigDecimal> textMentions) {
        var price = extraction.price();
        if (price == null || price.signum() <= 0) {
            return Confidence.UNKNOWN;
        }
        if (extraction.currency() != null && !extraction.currency().equalsIgnoreCase(expectedCurrency)) {
            return Confidence.LOW;
        }
        if (distinct(extraction.candidates()).size() > 1) {
            return Confidence.LOW;
        }
        if (textMentions.stream().noneMatch(p -> p.compareTo(price) == 0)) {
            return Confidence.LOW;
        }
        return Confidence.HIGH;
    }

    private static List<BigDecimal> distinct(List<BigDecimal> prices) {
        var out = new ArrayList<BigDecimal>();
        if (prices == null) {
            return out;
        }
        for (var p : prices) {
            if (p != null && p.signum() > 0 && out.stream().noneMatch(o -> o.compareTo(p) == 0)) {
                out.add(p);
            }
        }
        return out;
    }
}
