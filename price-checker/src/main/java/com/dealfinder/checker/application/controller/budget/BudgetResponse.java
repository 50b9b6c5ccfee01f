package com.dealfinder.checker.application.controller.budget;

import com.dealfinder.checker.domain.cost.BudgetPeriod;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BudgetResponse(
        BudgetPeriod period,
        LocalDate periodStart,
        BigDecimal ceiling,
        BigDecimal committed,
        BigDecimal reserved,
        BigDecimal remaining) {}
