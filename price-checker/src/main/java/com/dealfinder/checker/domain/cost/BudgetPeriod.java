package com.dealfinder.checker.domain.cost;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

public enum BudgetPeriod {
    DAILY {
        @Override
        public LocalDate bucketOf(Instant instant, ZoneId zone) {
            return LocalDate.ofInstant(instant, zone);
        }
    },
    MONTHLY {
        @Override
        public LocalDate bucketOf(Instant instant, ZoneId zone) {
            return LocalDate.ofInstant(instant, zone).withDayOfMonth(1);
        }
    };

    /** First day of the period containing {@code instant}; used as the ledger date bucket. */
    public abstract LocalDate bucketOf(Instant instant, ZoneId zone);
}
