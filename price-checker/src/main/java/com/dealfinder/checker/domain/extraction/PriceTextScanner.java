package com.dealfinder.checker.domain.extraction;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Finds the price amounts written in source text so the model's answer can be cross-checked.
 * Amounts followed by a monthly marker are instalment or subscription figures and are skipped.
 */
@Component
public class PriceTextScanner {

    private static final Pattern PRICE = Pattern.compile(
            "(?:[$€£]|\\b(?:USD|EUR|GBP))\\s?(\\d{1,3}(?:,\\d{3})+|\\d+)(\\.\\d{2})?");
    private static final List<String> MONTHLY_MARKERS = List.of("/mo", "per month", "a month", "monthly");
    private static final int MARKER_WINDOW = 16;

    public List<BigDecimal> priceMentions(String text) {
        var found = new ArrayList<BigDecimal>();
        if (text == null || text.isEmpty()) {
            return found;
        }
        var matcher = PRICE.matcher(text);
        while (matcher.find()) {
            var following = text.substring(matcher.end(), Math.min(text.length(), matcher.end() + MARKER_WINDOW))
                    .toLowerCase(Locale.ROOT);
            if (MONTHLY_MARKERS.stream().anyMatch(following::contains)) {
                continue;
            }
            var digits = matcher.group(1).replace(",", "");
            var cents = matcher.group(2) == null ? "" : matcher.group(2);
            var amount = new BigDecimal(digits + cents);
            if (amount.signum() > 0 && found.stream().noneMatch(p -> p.compareTo(amount) == 0)) {
                found.add(amount);
            }
        }
        return found;
    }
}
