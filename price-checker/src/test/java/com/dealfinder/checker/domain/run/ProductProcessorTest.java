package com.dealfinder.checker.domain.run;

import com.dealfinder.checker.domain.detection.Decision;
import com.dealfinder.checker.domain.detection.PriceChangeDetector;
import com.dealfinder.checker.domain.detection.SuppressReason;
import com.dealfinder.checker.domain.extraction.Confidence;
import com.dealfinder.checker.domain.extraction.ExtractionResult;
import com.dealfinder.checker.domain.extraction.PriceExtractor;
import com.dealfinder.checker.domain.notification.Channel;
import com.dealfinder.checker.domain.notification.DispatchResult;
import com.dealfinder.checker.domain.notification.DispatchStatus;
import com.dealfinder.checker.domain.notification.NotificationDispatcher;
import com.dealfinder.checker.domain.product.ProductRepository;
import com.dealfinder.checker.domain.product.TrackedProduct;
import com.dealfinder.common.event.ErrorKind;
import com.dealfinder.common.event.OutcomeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

import static com.dealfinder.checker.test.fixtures.ProductFixtures.SOME_INSTANT;
import static com.dealfinder.checker.test.fixtures.ProductFixtures.SOME_PRODUCT_ID;
import static com.dealfinder.checker.test.fixtures.ProductFixtures.observation;
import static com.dealfinder.checker.test.fixtures.ProductFixtures.trackedProductBuilder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class ProductProcessorTest {

    private static final BigDecimal SPEND = new BigDecimal("0.012");
    private static final String NOTIFICATION_ID = SOME_PRODUCT_ID + ":80:20522";

    @Mock
    PriceExtractor priceExtractor;

    @Mock
    PriceChangeDetector changeDetector;

    @Mock
    NotificationDispatcher dispatcher;

    @Mock
    ProductRepository productRepository;

    private ProductProcessor processor;

    private final TrackedProduct product = trackedProductBuilder().lastKnownPrice(new BigDecimal("100.00")).build();

    @BeforeEach
    void setUp() {
        processor = new ProductProcessor(priceExtractor, changeDetector, dispatcher, productRepository,
                Clock.fixed(SOME_INSTANT, ZoneOffset.UTC));
    }

    private void observed(String price, Confidence confidence, Decision decision) {
        var observation = observation(price, confidence);
        given(priceExtractor.extract(product)).willReturn(ExtractionResult.observed(observation, SPEND));
        given(changeDetector.decide(product, observation)).willReturn(decision);
    }

    @Nested
    class Notify {

        @Test
        void shouldNotifyDropAndMoveBaseline() {
            var decision = Decision.notifyDrop(new BigDecimal("100.00"), new BigDecimal("80.00"), NOTIFICATION_ID);
            observed("80.00", Confidence.HIGH, decision);
            given(dispatcher.dispatch(product, decision))
                    .willReturn(new DispatchResult(DispatchStatus.SENT, NOTIFICATION_ID, Set.of(Channel.EMAIL), Map.of()));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.NOTIFIED);
            assertThat(outcome.oldPrice()).isEqualByComparingTo("100.00");
            assertThat(outcome.newPrice()).isEqualByComparingTo("80.00");
            assertThat(outcome.notificationId()).isEqualTo(NOTIFICATION_ID);
            assertThat(outcome.spend()).isEqualByComparingTo(SPEND);
            then(productRepository).should().updatePrice(SOME_PRODUCT_ID, new BigDecimal("80.00"), SOME_INSTANT);
        }

        @Test
        void shouldFlagPartialDelivery() {
            var decision = Decision.notifyDrop(new BigDecimal("100.00"), new BigDecimal("80.00"), NOTIFICATION_ID);
            observed("80.00", Confidence.HIGH, decision);
            given(dispatcher.dispatch(product, decision)).willReturn(new DispatchResult(
                    DispatchStatus.PARTIALLY_FAILED, NOTIFICATION_ID, Set.of(Channel.EMAIL), Map.of(Channel.SMS, "down")));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.NOTIFIED);
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.CHANNEL_DELIVERY);
            then(productRepository).should().updatePrice(SOME_PRODUCT_ID, new BigDecimal("80.00"), SOME_INSTANT);
        }

        @Test
        void shouldKeepBaselineWhenDispatchFails() {
            var decision = Decision.notifyDrop(new BigDecimal("100.00"), new BigDecimal("80.00"), NOTIFICATION_ID);
            observed("80.00", Confidence.HIGH, decision);
            given(dispatcher.dispatch(product, decision)).willReturn(new DispatchResult(
                    DispatchStatus.FAILED, NOTIFICATION_ID, Set.of(), Map.of(Channel.EMAIL, "smtp down")));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.DISPATCH_FAILED);
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.CHANNEL_DELIVERY);
            then(productRepository).should().markChecked(SOME_PRODUCT_ID, SOME_INSTANT);
            then(productRepository).should(never()).updatePrice(any(), any(), any());
        }

        @Test
        void shouldTreatLostClaimAsDuplicate() {
            var decision = Decision.notifyDrop(new BigDecimal("100.00"), new BigDecimal("80.00"), NOTIFICATION_ID);
            observed("80.00", Confidence.HIGH, decision);
            given(dispatcher.dispatch(product, decision)).willReturn(
                    new DispatchResult(DispatchStatus.SUPPRESSED, NOTIFICATION_ID, Set.of(), Map.of()));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.SUPPRESSED);
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.DUPLICATE_NOTIFICATION);
            then(productRepository).should().updatePrice(SOME_PRODUCT_ID, new BigDecimal("80.00"), SOME_INSTANT);
        }
    }

    @Nested
    class NoNotify {

        @Test
        void shouldRecordUnchangedPrice() {
            observed("100.00", Confidence.HIGH, Decision.noChange(new BigDecimal("100.00")));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.NO_CHANGE);
            then(productRepository).should().updatePrice(SOME_PRODUCT_ID, new BigDecimal("100.00"), SOME_INSTANT);
            then(dispatcher).shouldHaveNoInteractions();
        }

        @Test
        void shouldOnlyTouchCheckedAtForDistrustedReading() {
            observed("40.00", Confidence.LOW, Decision.suppress(SuppressReason.LOW_CONFIDENCE, new BigDecimal("40.00"), null));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.SUPPRESSED);
            assertThat(outcome.detail()).isEqualTo("LOW_CONFIDENCE");
            then(productRepository).should().markChecked(SOME_PRODUCT_ID, SOME_INSTANT);
            then(productRepository).should(never()).updatePrice(any(), any(), any());
        }

        @Test
        void shouldMoveBaselineForDuplicateDrop() {
            observed("80.00", Confidence.HIGH,
                    Decision.suppress(SuppressReason.DUPLICATE, new BigDecimal("80.00"), NOTIFICATION_ID));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.SUPPRESSED);
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.DUPLICATE_NOTIFICATION);
            then(productRepository).should().updatePrice(SOME_PRODUCT_ID, new BigDecimal("80.00"), SOME_INSTANT);
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldSkipProductWhenBudgetIsExhausted() {
            given(priceExtractor.extract(product)).willReturn(ExtractionResult.budgetExceeded("no budget", BigDecimal.ZERO));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.BUDGET_SKIPPED);
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.BUDGET_EXCEEDED);
            then(productRepository).shouldHaveNoInteractions();
            then(changeDetector).shouldHaveNoInteractions();
        }

        @Test
        void shouldLeaveStateAloneWhenExtractionFails() {
            given(priceExtractor.extract(product))
                    .willReturn(ExtractionResult.failed(ErrorKind.EXTRACTION_FAILED, "No price found in sources", SPEND));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.EXTRACTION_FAILED);
            assertThat(outcome.spend()).isEqualByComparingTo(SPEND);
            then(productRepository).shouldHaveNoInteractions();
        }

        @Test
        void shouldReportUnexpectedExtractionFailureWithItsSpend() {
            given(priceExtractor.extract(product))
                    .willReturn(ExtractionResult.failed(ErrorKind.UNEXPECTED, "java.lang.IllegalStateException: boom", SPEND));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.ERROR);
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.UNEXPECTED);
            assertThat(outcome.spend()).isEqualByComparingTo(SPEND);
            then(productRepository).shouldHaveNoInteractions();
        }

        @Test
        void shouldReportLedgerFailureDuringExtractionAsPersistenceFailure() {
            given(priceExtractor.extract(product))
                    .willReturn(ExtractionResult.failed(ErrorKind.PERSISTENCE_ERROR, "db down", SPEND));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.PERSISTENCE_FAILED);
            assertThat(outcome.spend()).isEqualByComparingTo(SPEND);
        }

        @Test
        void shouldReportPersistenceFailureAfterNotifying() {
            var decision = Decision.notifyDrop(new BigDecimal("100.00"), new BigDecimal("80.00"), NOTIFICATION_ID);
            observed("80.00", Confidence.HIGH, decision);
            given(dispatcher.dispatch(product, decision))
                    .willReturn(new DispatchResult(DispatchStatus.SENT, NOTIFICATION_ID, Set.of(Channel.EMAIL), Map.of()));
            willThrow(new DataAccessResourceFailureException("db down"))
                    .given(productRepository).updatePrice(SOME_PRODUCT_ID, new BigDecimal("80.00"), SOME_INSTANT);

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.PERSISTENCE_FAILED);
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.PERSISTENCE_ERROR);
            assertThat(outcome.notificationId()).isEqualTo(NOTIFICATION_ID);
        }

        @Test
        void shouldReportStoreFailureDuringDetection() {
            var observation = observation("80.00", Confidence.HIGH);
            given(priceExtractor.extract(product)).willReturn(ExtractionResult.observed(observation, SPEND));
            given(changeDetector.decide(product, observation)).willThrow(new DataAccessResourceFailureException("db down"));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.PERSISTENCE_FAILED);
            assertThat(outcome.spend()).isEqualByComparingTo(SPEND);
        }

        @Test
        void shouldNeverThrowOnUnexpectedFailure() {
            given(priceExtractor.extract(product)).willThrow(new IllegalStateException("boom"));

            var outcome = processor.process(product);

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.ERROR);
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.UNEXPECTED);
            assertThat(outcome.detail()).isEqualTo("boom");
        }
    }
}
