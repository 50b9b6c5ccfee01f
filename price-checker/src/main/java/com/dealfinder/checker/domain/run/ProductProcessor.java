package com.dealfinder.checker.domain.run;

import com.dealfinder.checker.domain.detection.Decision;
import com.dealfinder.checker.domain.detection.PriceChangeDetector;
import com.dealfinder.checker.domain.detection.SuppressReason;
import com.dealfinder.checker.domain.extraction.ExtractionResult;
import com.dealfinder.checker.domain.extraction.PriceExtractor;
import com.dealfinder.checker.domain.notification.DispatchResult;
import com.dealfinder.checker.domain.notification.DispatchStatus;
import com.dealfinder.checker.domain.notification.NotificationDispatcher;
import com.dealfinder.checker.domain.product.ProductRepository;
import com.dealfinder.checker.domain.product.TrackedProduct;
import com.dealfinder.common.event.ErrorKind;
import com.dealfinder.common.event.OutcomeKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Runs one product through extract, decide, dispatch and persist, and always answers with a
 * {@link ProductOutcome}.
 *
 * <p>The baseline price moves only when the observation is trusted and, for drops, once the
 * notification went out. Distrusted readings and failed deliveries only touch
 * {@code last_checked_at} so the same drop is detected again on the next run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductProcessor {

    private final PriceExtractor priceExtractor;
    private final PriceChangeDetector changeDetector;
    private final NotificationDispatcher dispatcher;
    private final ProductRepository productRepository;
    private final Clock clock;

    public ProductOutcome process(TrackedProduct product) {
        var spend = BigDecimal.ZERO;
        try {
            var extraction = priceExtractor.extract(product);
            spend = extraction.spend();
            if (!extraction.isObserved()) {
                return extractionOutcome(product, extraction);
            }

            var observed = extraction.observation().observedPrice();
            var decision = changeDetector.decide(product, extraction.observation());
            return switch (decision.type()) {
                case NO_CHANGE -> persistPrice(product, observed, spend, base(product, OutcomeKind.NO_CHANGE, decision, spend));
                case SUPPRESS -> suppressed(product, decision, spend);
                case NOTIFY -> notified(product, decision, spend);
            };
        } catch (DataAccessException e) {
            log.error("product.persistence_failed: product_id={}", product.productId(), e);
            return failure(product, OutcomeKind.PERSISTENCE_FAILED, ErrorKind.PERSISTENCE_ERROR, e, spend);
        } catch (RuntimeException e) {
            log.error("product.unexpected_failure: product_id={}", product.productId(), e);
            return failure(product, OutcomeKind.ERROR, ErrorKind.UNEXPECTED, e, spend);
        }
    }

    private ProductOutcome extractionOutcome(TrackedProduct product, ExtractionResult extraction) {
        var kind = switch (extraction.errorKind()) {
            case BUDGET_EXCEEDED -> OutcomeKind.BUDGET_SKIPPED;
            case PERSISTENCE_ERROR -> OutcomeKind.PERSISTENCE_FAILED;
            case UNEXPECTED -> OutcomeKind.ERROR;
            default -> OutcomeKind.EXTRACTION_FAILED;
        };
        return ProductOutcome.builder()
                .productId(product.productId())
                .kind(kind)
                .errorKind(extraction.errorKind())
                .oldPrice(product.lastKnownPrice())
                .detail(extraction.reason())
                .spend(extraction.spend())
                .build();
    }

    private ProductOutcome suppressed(TrackedProduct product, Decision decision, BigDecimal spend) {
        var outcome = base(product, OutcomeKind.SUPPRESSED, decision, spend).toBuilder()
                .detail(decision.suppressReason().name());
        if (decision.suppressReason() == SuppressReason.DUPLICATE) {
            return persistPrice(product, decision.newPrice(), spend,
                    outcome.errorKind(ErrorKind.DUPLICATE_NOTIFICATION).build());
        }
        return persistChecked(product, spend, outcome.build());
    }

    private ProductOutcome notified(TrackedProduct product, Decision decision, BigDecimal spend) {
        DispatchResult result = dispatcher.dispatch(product, decision);
        var outcome = base(product, OutcomeKind.NOTIFIED, decision, spend).toBuilder()
                .notificationId(result.notificationId());

        if (result.isDelivered()) {
            if (result.status() == DispatchStatus.PARTIALLY_FAILED) {
                outcome.errorKind(ErrorKind.CHANNEL_DELIVERY).detail("Failed channels: " + result.failures().keySet());
            }
            return persistPrice(product, decision.newPrice(), spend, outcome.build());
        }
        if (result.status() == DispatchStatus.SUPPRESSED) {
            return persistPrice(product, decision.newPrice(), spend, outcome
                    .kind(OutcomeKind.SUPPRESSED)
                    .errorKind(ErrorKind.DUPLICATE_NOTIFICATION)
                    .detail(SuppressReason.DUPLICATE.name())
                    .build());
        }
        return persistChecked(product, spend, outcome
                .kind(OutcomeKind.DISPATCH_FAILED)
                .errorKind(ErrorKind.CHANNEL_DELIVERY)
                .detail(result.failures().isEmpty() ? "No deliverable channel" : "Failed channels: " + result.failures().keySet())
                .build());
    }

    private ProductOutcome persistPrice(TrackedProduct product, BigDecimal price, BigDecimal spend, ProductOutcome outcome) {
        try {
            productRepository.updatePrice(product.productId(), price, clock.instant());
            return outcome;
        } catch (RuntimeException e) {
            log.error("product.update_price_failed: product_id={}", product.productId(), e);
            return persistenceFailed(outcome, e, spend);
        }
    }

    private ProductOutcome persistChecked(TrackedProduct product, BigDecimal spend, ProductOutcome outcome) {
        try {
            productRepository.markChecked(product.productId(), clock.instant());
            return outcome;
        } catch (RuntimeException e) {
            log.error("product.mark_checked_failed: product_id={}", product.productId(), e);
            return persistenceFailed(outcome, e, spend);
        }
    }

    private static ProductOutcome persistenceFailed(ProductOutcome outcome, RuntimeException e, BigDecimal spend) {
        return outcome.toBuilder()
                .kind(OutcomeKind.PERSISTENCE_FAILED)
                .errorKind(ErrorKind.PERSISTENCE_ERROR)
                .detail(outcome.kind() + " not persisted: " + e.getMessage())
                .spend(spend)
                .build();
    }

    private static ProductOutcome base(TrackedProduct product, OutcomeKind kind, Decision decision, BigDecimal spend) {
        return ProductOutcome.builder()
                .productId(product.productId())
                .kind(kind)
                .oldPrice(product.lastKnownPrice())
                .newPrice(decision.newPrice())
                .notificationId(decision.notificationId())
                .spend(spend)
                .build();
    }

    private static ProductOutcome failure(
            TrackedProduct product, OutcomeKind kind, ErrorKind errorKind, RuntimeException e, BigDecimal spend) {
        return ProductOutcome.builder()
                .productId(product.productId())
                .kind(kind)
                .errorKind(errorKind)
                .oldPrice(product.lastKnownPrice())
                .detail(e.getMessage())
                .spend(spend)
                .build();
    }
}
