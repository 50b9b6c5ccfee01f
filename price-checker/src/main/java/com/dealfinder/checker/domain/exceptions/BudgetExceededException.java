package com.dealfinder.checker.domain.exceptions;

import com.dealfinder.checker.domain.cost.BillableApi;

import java.math.BigDecimal;

public class BudgetExceededException extends RuntimeException {

    private BudgetExceededException(String message) {
        super(message);
    }

    public static BudgetExceededException of(BillableApi api, BigDecimal estimate, BigDecimal remaining) {
        return new BudgetExceededException(
                "Budget exceeded for " + api + ": estimate " + estimate.toPlainString()
                        + ", remaining " + remaining.toPlainString());
    }
}
