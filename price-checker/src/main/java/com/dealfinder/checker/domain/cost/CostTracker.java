package com.dealfinder.checker.domain.cost;

import com.dealfinder.checker.domain.exceptions.BudgetExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps committed spend plus outstanding reservations within the period ceiling.
 *
 * <p>All bookkeeping happens under one lock, so concurrent workers see a single sequence of
 * reserve/commit steps. Totals for a period are loaded from the ledger the first time the period
 * is touched; on rollover the in-memory counters restart from the new period's ledger rows.
 * Spend can overshoot the ceiling only by the amount actual costs exceed their estimates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CostTracker {

    private final BudgetPolicy policy;
    private final SpendLedgerRepository ledger;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<BillableApi, BigDecimal> committed = new EnumMap<>(BillableApi.class);
    private BigDecimal reserved = BigDecimal.ZERO;
    private LocalDate currentBucket;

    public Reservation reserve(BillableApi api) {
        return reserve(api, policy.estimateFor(api));
    }

    public Reservation reserve(BillableApi api, BigDecimal estimatedCost) {
        lock.lock();
        try {
            rollIfNeeded();
            var remaining = remaining();
            if (estimatedCost.compareTo(remaining) > 0) {
                log.info("budget.denied: api={}, estimate={}, remaining={}", api, estimatedCost, remaining);
                throw BudgetExceededException.of(api, estimatedCost, remaining);
            }
            reserved = reserved.add(estimatedCost);
            return new Reservation(api, estimatedCost, currentBucket);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the reservation and books {@code actualCost}; a null cost books the estimate. The
     * ledger row is written after the lock is released; a failed write is logged and the spend
     * stays counted in memory.
     *
     * @return the amount booked
     */
    public BigDecimal commit(Reservation reservation, BigDecimal actualCost) {
        var amount = actualCost != null ? actualCost : reservation.estimated();
        lock.lock();
        try {
            rollIfNeeded();
            if (reservation.dateBucket().equals(currentBucket)) {
                reserved = reserved.subtract(reservation.estimated()).max(BigDecimal.ZERO);
                committed.merge(reservation.api(), amount, BigDecimal::add);
            }
        } finally {
            lock.unlock();
        }

        try {
            ledger.addSpend(reservation.dateBucket(), reservation.api(), amount);
        } catch (RuntimeException e) {
            log.warn("budget.ledger_write_failed: bucket={}, api={}, amount={}",
                    reservation.dateBucket(), reservation.api(), amount, e);
        }
        return amount;
    }

    public BudgetSnapshot remainingBudget() {
        lock.lock();
        try {
            rollIfNeeded();
            return BudgetSnapshot.builder()
                    .period(policy.period())
                    .periodStart(currentBucket)
                    .ceiling(policy.ceiling())
                    .committed(totalCommitted())
                    .reserved(reserved)
                    .remaining(remaining())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private void rollIfNeeded() {
        var bucket = policy.period().bucketOf(clock.instant(), policy.zone());
        if (bucket.equals(currentBucket)) {
            return;
        }
        var persisted = ledger.findSpend(bucket);
        committed.clear();
        committed.putAll(persisted);
        reserved = BigDecimal.ZERO;
        if (currentBucket != null) {
            log.info("budget.period_rolled: from={}, to={}", currentBucket, bucket);
        }
        currentBucket = bucket;
    }

    private BigDecimal remaining() {
        return policy.ceiling().subtract(totalCommitted()).subtract(reserved).max(BigDecimal.ZERO);
    }

    private BigDecimal totalCommitted() {
        return committed.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
