package com.dealfinder.checker.infrastructure.db.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;

@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class SpendLedgerId implements Serializable {

    @Column(name = "date_bucket", nullable = false)
    private LocalDate dateBucket;

    @Column(name = "api_name", nullable = false, length = 32)
    private String apiName;
}
