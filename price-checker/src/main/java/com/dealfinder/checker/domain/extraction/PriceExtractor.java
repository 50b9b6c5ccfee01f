package com.dealfinder.checker.domain.extraction;

import com.dealfinder.checker.domain.cost.BillableApi;
import com.dealfinder.checker.domain.cost.CostTracker;
import com.dealfinder.checker.domain.exceptions.BudgetExceededException;
import com.dealfinder.checker.domain.exceptions.ProviderException;
import com.dealfinder.checker.domain.exceptions.TransientApiException;
import com.dealfinder.checker.domain.product.TrackedProduct;
import com.dealfinder.common.event.ErrorKind;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Turns a tracked product into a price observation: search, filter the hits, let the language
 * model read the price, then grade how much the answer can be trusted.
 *
 * <p>Every chargeable call reserves budget first and commits its cost afterwards, even when the
 * call fails. A denied reservation ends the extraction immediately and is never retried.
 *
 * <p>Names and queries that {@link ProductInputGuard} refuses fail before any budget is reserved.
 */
@Slf4j
@Service
public class PriceExtractor {

    private static final String DEFAULT_CURRENCY = "USD";

    private final SearchProvider searchProvider;
    private final PriceExtractionModel extractionModel;
    private final CostTracker costTracker;
    private final SearchResultFilter resultFilter;
    private final PriceTextScanner textScanner;
    private final ConfidenceAssessor confidenceAssessor;
    private final ExtractionSettings settings;
    private final Clock clock;
    private final Retry searchRetry;
    private final Retry extractionRetry;

    public PriceExtractor(
            SearchProvider searchProvider,
            PriceExtractionModel extractionModel,
            CostTracker costTracker,
            SearchResultFilter resultFilter,
            PriceTextScanner textScanner,
            ConfidenceAssessor confidenceAssessor,
            ExtractionSettings settings,
            RetryPolicy retryPolicy,
            Clock clock) {
        this.searchProvider = searchProvider;
        this.extractionModel = extractionModel;
        this.costTracker = costTracker;
        this.resultFilter = resultFilter;
        this.textScanner = textScanner;
        this.confidenceAssessor = confidenceAssessor;
        this.settings = settings;
        this.clock = clock;

        var backoff = IntervalFunction.ofExponentialBackoff(retryPolicy.initialBackoff(), retryPolicy.multiplier());
        this.searchRetry = Retry.of("search", RetryConfig.<SearchResponse>custom()
                .maxAttempts(retryPolicy.maxAttempts())
                .intervalFunction(backoff)
                .retryExceptions(TransientApiException.class)
                .build());
        this.extractionRetry = Retry.of("llm-extraction", RetryConfig.<Assessment>custom()
                .maxAttempts(retryPolicy.maxAttempts())
                .intervalFunction(backoff)
                .retryExceptions(TransientApiException.class)
                .retryOnResult(assessment -> assessment.confidence() == Confidence.UNKNOWN)
                .build());
    }

    /** Never throws: unexpected failures come back as FAILED results carrying the spend booked so far. */
    public ExtractionResult extract(TrackedProduct product) {
        var spend = new AtomicReference<>(BigDecimal.ZERO);
        try {
            return extract(product, spend);
        } catch (DataAccessException e) {
            log.error("extraction.store_failed: product_id={}", product.productId(), e);
            return ExtractionResult.failed(ErrorKind.PERSISTENCE_ERROR, e.getMessage(), spend.get());
        } catch (RuntimeException e) {
            log.error("extraction.unexpected_failure: product_id={}", product.productId(), e);
            return ExtractionResult.failed(ErrorKind.UNEXPECTED, String.valueOf(e), spend.get());
        }
    }

    private ExtractionResult extract(TrackedProduct product, AtomicReference<BigDecimal> spend) {
        var rejection = ProductInputGuard.rejection(product);
        if (rejection.isPresent()) {
            log.warn("extraction.input_rejected: product_id={}, reason={}", product.productId(), rejection.get());
            return ExtractionResult.failed(ErrorKind.EXTRACTION_FAILED, rejection.get(), spend.get());
        }
        var expectedCurrency = product.currency() != null ? product.currency() : DEFAULT_CURRENCY;

        List<SearchHit> sources;
        try {
            var query = SearchQueries.forProduct(product);
            var response = searchRetry.executeSupplier(() -> chargedSearch(query, spend));
            sources = resultFilter.usable(response.hits());
        } catch (BudgetExceededException e) {
            return ExtractionResult.budgetExceeded(e.getMessage(), spend.get());
        } catch (TransientApiException e) {
            log.warn("extraction.search_failed: product_id={}, reason={}", product.productId(), e.getMessage());
            return ExtractionResult.failed(ErrorKind.TRANSIENT_IO, e.getMessage(), spend.get());
        } catch (ProviderException e) {
            log.warn("extraction.search_rejected: product_id={}, reason={}", product.productId(), e.getMessage());
            return ExtractionResult.failed(ErrorKind.EXTRACTION_FAILED, e.getMessage(), spend.get());
        }

        if (sources.isEmpty()) {
            log.info("extraction.no_sources: product_id={}", product.productId());
            return ExtractionResult.failed(ErrorKind.EXTRACTION_FAILED, "No usable shopping sources", spend.get());
        }

        var productName = ProductInputGuard.sanitize(product.name());
        var sourceText = sourceText(sources);
        var mentions = textScanner.priceMentions(sourceText);

        Assessment assessment;
        try {
            assessment = extractionRetry.executeSupplier(
                    () -> chargedExtraction(productName, sourceText, expectedCurrency, mentions, spend));
        } catch (BudgetExceededException e) {
            return ExtractionResult.budgetExceeded(e.getMessage(), spend.get());
        } catch (TransientApiException e) {
            log.warn("extraction.model_failed: product_id={}, reason={}", product.productId(), e.getMessage());
            return ExtractionResult.failed(ErrorKind.TRANSIENT_IO, e.getMessage(), spend.get());
        } catch (ProviderException e) {
            log.warn("extraction.model_rejected: product_id={}, reason={}", product.productId(), e.getMessage());
            return ExtractionResult.failed(ErrorKind.EXTRACTION_FAILED, e.getMessage(), spend.get());
        }

        if (assessment.confidence() == Confidence.UNKNOWN) {
            log.info("extraction.price_unknown: product_id={}", product.productId());
            return ExtractionResult.failed(ErrorKind.EXTRACTION_FAILED, "No price found in sources", spend.get());
        }

        var extraction = assessment.extraction();
        var observation = PriceObservation.builder()
                .productId(product.productId())
                .observedPrice(extraction.price())
                .currency(extraction.currency() != null ? extraction.currency().toUpperCase(Locale.ROOT) : expectedCurrency)
                .confidence(assessment.confidence())
                .observedAt(clock.instant())
                .build();
        log.debug("extraction.observed: product_id={}, price={}, confidence={}",
                product.productId(), observation.observedPrice(), observation.confidence());
        return ExtractionResult.observed(observation, spend.get());
    }

    private SearchResponse chargedSearch(String query, AtomicReference<BigDecimal> spend) {
        var reservation = costTracker.reserve(BillableApi.SEARCH);
        BigDecimal actualCost = null;
        try {
            var response = searchProvider.search(query, settings.maxResults());
            actualCost = response.cost();
            return response;
        } finally {
            var booked = costTracker.commit(reservation, actualCost);
            spend.accumulateAndGet(booked, BigDecimal::add);
        }
    }

    private Assessment chargedExtraction(
            String productName,
            String sourceText,
            String expectedCurrency,
            List<BigDecimal> mentions,
            AtomicReference<BigDecimal> spend) {
        var reservation = costTracker.reserve(BillableApi.LLM_EXTRACTION);
        BigDecimal actualCost = null;
        try {
            var extraction = extractionModel.extract(productName, sourceText);
            actualCost = extraction.cost();
            return new Assessment(extraction, confidenceAssessor.assess(extraction, expectedCurrency, mentions));
        } finally {
            var booked = costTracker.commit(reservation, actualCost);
            spend.accumulateAndGet(booked, BigDecimal::add);
        }
    }

    private String sourceText(List<SearchHit> sources) {
        var text = sources.stream()
                .map(hit -> "Title: " + nullToEmpty(hit.title()) + "\nURL: " + hit.url() + "\n" + nullToEmpty(hit.content()))
                .collect(Collectors.joining("\n\n"));
        return text.length() > settings.maxSourceChars() ? text.substring(0, settings.maxSourceChars()) : text;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record Assessment(ModelExtraction extraction, Confidence confidence) {}
}
