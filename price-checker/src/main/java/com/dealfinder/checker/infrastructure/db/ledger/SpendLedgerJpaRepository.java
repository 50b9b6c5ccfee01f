package com.dealfinder.checker.infrastructure.db.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public interface SpendLedgerJpaRepository extends JpaRepository<SpendLedgerRow, SpendLedgerId> {

    List<SpendLedgerRow> findByIdDateBucket(LocalDate dateBucket);

    @Modifying
    @Query(value = "INSERT INTO spend_ledger (date_bucket, api_name, amount_spent, updated_at) " +
            "VALUES (:dateBucket, :apiName, :amount, :updatedAt) " +
            "ON CONFLICT (date_bucket, api_name) DO UPDATE " +
            "SET amount_spent = spend_ledger.amount_spent + EXCLUDED.amount_spent, updated_at = EXCLUDED.updated_at",
            nativeQuery = true)
    int addSpend(LocalDate dateBucket, String apiName, BigDecimal amount, Instant updatedAt);
}
