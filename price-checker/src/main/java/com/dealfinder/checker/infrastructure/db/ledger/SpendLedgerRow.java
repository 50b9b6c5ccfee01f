package com.dealfinder.checker.infrastructure.db.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "spend_ledger")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SpendLedgerRow {

    @EmbeddedId
    private SpendLedgerId id;

    @Column(name = "amount_spent", nullable = false, precision = 12, scale = 6)
    private BigDecimal amountSpent;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
