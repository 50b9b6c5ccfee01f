package com.dealfinder.checker.infrastructure.search;

import com.dealfinder.checker.application.config.CheckerProperties;
import com.dealfinder.checker.domain.exceptions.ProviderException;
import com.dealfinder.checker.domain.extraction.SearchHit;
import com.dealfinder.checker.domain.extraction.SearchProvider;
import com.dealfinder.checker.domain.extraction.SearchResponse;
import com.dealfinder.checker.infrastructure.http.ProviderErrors;
import com.dealfinder.common.json.JacksonConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.List;

/** Tavily-compatible {@code POST /search}. Billed per call, so no cost is reported back. */
@Slf4j
@Component
public class TavilySearchClient implements SearchProvider {

    private static final String PROVIDER = "search";

    private final RestTemplate restTemplate;
    private final CheckerProperties.Search properties;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    public TavilySearchClient(@Qualifier("searchRestTemplate") RestTemplate restTemplate, CheckerProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties.search();
    }

    @Override
    public SearchResponse search(String query, int maxResults) {
        var headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
            headers.setBearerAuth(properties.apiKey());
        }
        var body = objectMapper.writeValueAsString(new TavilySearchRequest(query, maxResults, "basic", false));

        String raw;
        try {
            raw = restTemplate.postForObject(properties.baseUrl() + "/search", new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            throw ProviderErrors.classify(PROVIDER, e);
        }

        TavilySearchResponse response;
        try {
            response = raw == null ? null : objectMapper.readValue(raw, TavilySearchResponse.class);
        } catch (JacksonException e) {
            throw ProviderException.of(PROVIDER, "unreadable response", e);
        }
        if (response == null || response.results() == null) {
            return new SearchResponse(List.of(), null);
        }

        var hits = response.results().stream()
                .map(r -> new SearchHit(r.url(), r.title(), r.content()))
                .toList();
        log.debug("Search for '{}' returned {} hits", query, hits.size());
        return new SearchResponse(hits, null);
    }
}
