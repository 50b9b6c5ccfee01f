package com.dealfinder.checker.domain.cost;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.Map;

@Builder(toBuilder = true)
public record BudgetPolicy(
        BigDecimal ceiling,
        BudgetPeriod period,
        ZoneId zone,
        Map<BillableApi, BigDecimal> estimates
) {

    public BigDecimal estimateFor(BillableApi api) {
        var estimate = estimates.get(api);
        if (estimate == null) {
            throw new IllegalStateException("No cost estimate configured for " + api);
        }
        return estimate;
    }
}
