package com.dealfinder.checker.domain.cost;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

@Builder
public record BudgetSnapshot(
        BudgetPeriod period,
        LocalDate periodStart,
        BigDecimal ceiling,
        BigDecimal committed,
        BigDecimal reserved,
        BigDecimal remaining
) {}
