package com.dealfinder.checker.application.controller.budget;

import com.dealfinder.checker.domain.cost.CostTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/budget")
@RequiredArgsConstructor
public class BudgetController {

    private final CostTracker costTracker;

    @GetMapping
    public BudgetResponse currentBudget() {
        var snapshot = costTracker.remainingBudget();
        return new BudgetResponse(
                snapshot.period(),
                snapshot.periodStart(),
                snapshot.ceiling(),
                snapshot.committed(),
                snapshot.reserved(),
                snapshot.remaining());
    }
}
