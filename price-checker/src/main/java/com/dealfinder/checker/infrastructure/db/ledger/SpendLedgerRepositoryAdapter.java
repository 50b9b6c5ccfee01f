package com.dealfinder.checker.infrastructure.db.ledger;

import com.dealfinder.checker.domain.cost.BillableApi;
import com.dealfinder.checker.domain.cost.SpendLedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

@Slf4j
@Repository
@RequiredArgsConstructor
public class SpendLedgerRepositoryAdapter implements SpendLedgerRepository {

    private final SpendLedgerJpaRepository jpaRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true, propagation = Propagation.REQUIRES_NEW)
    public Map<BillableApi, BigDecimal> findSpend(LocalDate dateBucket) {
        var spend = new EnumMap<BillableApi, BigDecimal>(BillableApi.class);
        for (var row : jpaRepository.findByIdDateBucket(dateBucket)) {
            try {
                spend.merge(BillableApi.valueOf(row.getId().getApiName()), row.getAmountSpent(), BigDecimal::add);
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring ledger row for unknown api {}", row.getId().getApiName());
            }
        }
        return spend;
    }

    @Override
    @Transactional
    public void addSpend(LocalDate dateBucket, BillableApi api, BigDecimal amount) {
        jpaRepository.addSpend(dateBucket, api.name(), amount, clock.instant());
    }
}
