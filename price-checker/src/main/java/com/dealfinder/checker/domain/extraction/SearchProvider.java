package com.dealfinder.checker.domain.extraction;

/**
 * Web search used to find pages that list the product's price.
 *
 * <p>Implementations throw {@code TransientApiException} for failures worth retrying and
 * {@code ProviderException} for everything else.
 */
public interface SearchProvider {

    SearchResponse search(String query, int maxResults);
}
