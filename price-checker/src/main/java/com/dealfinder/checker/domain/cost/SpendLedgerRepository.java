package com.dealfinder.checker.domain.cost;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

public interface SpendLedgerRepository {

    /** Spend recorded so far for the bucket, per api. Apis with no row are absent. */
    Map<BillableApi, BigDecimal> findSpend(LocalDate dateBucket);

    /** Atomically adds {@code amount} to the {@code (dateBucket, api)} row, creating it if missing. */
    void addSpend(LocalDate dateBucket, BillableApi api, BigDecimal amount);
}
