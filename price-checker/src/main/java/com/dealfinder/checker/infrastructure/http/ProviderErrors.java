package com.dealfinder.checker.infrastructure.http;

import com.dealfinder.checker.domain.exceptions.ProviderException;
import com.dealfinder.checker.domain.exceptions.TransientApiException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/** Maps HTTP client failures onto the retryable / permanent split the extractor relies on. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProviderErrors {

    public static RuntimeException classify(String provider, RestClientException e) {
        if (e instanceof ResourceAccessException) {
            return TransientApiException.of(provider, "I/O error: " + e.getMessage(), e);
        }
        if (e instanceof RestClientResponseException responseException) {
            var status = responseException.getStatusCode();
            if (status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return TransientApiException.of(provider, "HTTP " + status.value(), e);
            }
            return ProviderException.of(provider, "HTTP " + status.value(), e);
        }
        return ProviderException.of(provider, e.getMessage(), e);
    }
}
