package com.dealfinder.checker.domain.extraction;

import com.dealfinder.checker.domain.product.TrackedProduct;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Screens the free text a subscriber typed before any of it reaches a paid API. Product names and
 * search queries are both sent to the language model, so instruction-like text is refused outright
 * and everything else is reduced to plain words and prices.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProductInputGuard {

    static final int MIN_LENGTH = 3;
    static final int MAX_LENGTH = 1000;

    private static final List<Pattern> BLOCKED = List.of(
            Pattern.compile("ignore (previous|all|your) instruction", Pattern.CASE_INSENSITIVE),
            Pattern.compile("you are now", Pattern.CASE_INSENSITIVE),
            Pattern.compile("roleplay as", Pattern.CASE_INSENSITIVE),
            Pattern.compile("pretend (you are|to be)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("disregard.*rules", Pattern.CASE_INSENSITIVE),
            Pattern.compile("reveal.*prompt", Pattern.CASE_INSENSITIVE));

    private static final Pattern URL = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern SQL_FRAGMENT = Pattern.compile(
            "\\b(union|select|insert|update|delete|drop|create|alter)\\s+(all|distinct|from|into|table)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern REPEATED_PUNCTUATION = Pattern.compile("([!?.]){3,}");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s.,!?\\-$%]", Pattern.UNICODE_CHARACTER_CLASS);

    /** Reason the product's name or search query must not be used, empty when both are acceptable. */
    public static Optional<String> rejection(TrackedProduct product) {
        var nameProblem = problem("name", product.name());
        if (nameProblem.isPresent() || product.searchQuery() == null || product.searchQuery().isBlank()) {
            return nameProblem;
        }
        return problem("search query", product.searchQuery());
    }

    /** Strips links, markup and SQL-like fragments, leaving words, numbers and common price punctuation. */
    public static String sanitize(String text) {
        var cleaned = URL.matcher(text).replaceAll(" ");
        cleaned = HTML_TAG.matcher(cleaned).replaceAll(" ");
        cleaned = SQL_FRAGMENT.matcher(cleaned).replaceAll(" ");
        cleaned = REPEATED_PUNCTUATION.matcher(cleaned).replaceAll("$1$1");
        return DISALLOWED.matcher(cleaned).replaceAll("").strip();
    }

    private static Optional<String> problem(String field, String text) {
        if (text == null || text.isBlank()) {
            return Optional.of("Product " + field + " is empty");
        }
        var length = text.strip().length();
        if (length < MIN_LENGTH) {
            return Optional.of("Product " + field + " too short (minimum " + MIN_LENGTH + " characters)");
        }
        if (length > MAX_LENGTH) {
            return Optional.of("Product " + field + " too long (maximum " + MAX_LENGTH + " characters)");
        }
        return BLOCKED.stream().anyMatch(pattern -> pattern.matcher(text).find())
                ? Optional.of("Product " + field + " contains instruction-like text")
                : Optional.empty();
    }
}
