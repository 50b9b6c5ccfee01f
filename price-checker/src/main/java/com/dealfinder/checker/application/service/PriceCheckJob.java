package com.dealfinder.checker.application.service;

import com.dealfinder.checker.domain.run.RunOrchestrator;
import com.dealfinder.checker.domain.run.RunSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.EntityManager;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs the orchestrator at most once at a time across instances. The advisory lock belongs to the
 * surrounding transaction, so it is released when the run returns or fails.
 *
 * <p>Store reads made on this thread run in their own transactions ({@code REQUIRES_NEW}); a failed
 * read therefore ends up in the run summary instead of rolling back the lock transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceCheckJob {

    private static final long ADVISORY_LOCK_ID = 2001L;

    private final RunOrchestrator orchestrator;
    private final EntityManager entityManager;
    private final MeterRegistry meterRegistry;
    private final Counter priceCheckRunsCounter;
    private final Counter priceCheckRunsSkippedCounter;

    @Transactional
    public Optional<RunSummary> runIfIdle() {
        if (!acquireAdvisoryLock()) {
            log.info("Price check: another run holds the lock, skipping");
            priceCheckRunsSkippedCounter.increment();
            return Optional.empty();
        }

        var summary = orchestrator.run();
        priceCheckRunsCounter.increment();
        summary.outcomes().forEach(outcome ->
                meterRegistry.counter("checker.products.outcomes", "outcome", outcome.kind().name()).increment());
        return Optional.of(summary);
    }

    private boolean acquireAdvisoryLock() {
        var result = entityManager
                .createNativeQuery("SELECT pg_try_advisory_xact_lock(:lockId)")
                .setParameter("lockId", ADVISORY_LOCK_ID)
                .getSingleResult();
        return Boolean.TRUE.equals(result);
    }
}
