package com.dealfinder.checker.domain.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/** Drops hits that are not shop pages: video, social, forum and wiki sites, PDFs, reviews, blogs. */
@Slf4j
@Component
public class SearchResultFilter {

    static final List<String> EXCLUDED_DOMAINS = List.of(
            "youtube.com", "youtu.be", "reddit.com", "quora.com", "stackoverflow.com",
            "wikipedia.org", "twitter.com", "facebook.com", "instagram.com",
            "pinterest.com", "tumblr.com", "medium.com", "blogspot.com",
            "wordpress.com", "linkedin.com", "discord.com", "tiktok.com");

    static final List<String> EXCLUDED_KEYWORDS = List.of(
            "review", "comparison", "forum", "discussion", "article", "blog");

    public List<SearchHit> usable(List<SearchHit> hits) {
        return hits.stream()
                .filter(this::isShoppingSource)
                .toList();
    }

    boolean isShoppingSource(SearchHit hit) {
        if (hit.url() == null || hit.url().isBlank()) {
            return false;
        }
        var url = hit.url().toLowerCase(Locale.ROOT);
        var title = hit.title() == null ? "" : hit.title().toLowerCase(Locale.ROOT);

        var host = hostOf(url);
        if (EXCLUDED_DOMAINS.stream().anyMatch(d -> host.equals(d) || host.endsWith("." + d))) {
            log.debug("Skipping {} (excluded domain)", hit.url());
            return false;
        }
        if (url.endsWith(".pdf") || url.contains("/pdf")) {
            log.debug("Skipping {} (pdf)", hit.url());
            return false;
        }
        if (EXCLUDED_KEYWORDS.stream().anyMatch(k -> url.contains(k) || title.contains(k))) {
            log.debug("Skipping {} (non-product page)", hit.url());
            return false;
        }
        return true;
    }

    private static String hostOf(String url) {
        try {
            var host = URI.create(url.strip()).getHost();
            return host == null ? url : host;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }
}
