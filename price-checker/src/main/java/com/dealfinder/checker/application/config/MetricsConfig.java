package com.dealfinder.checker.application.config;

import com.dealfinder.checker.domain.cost.CostTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter priceCheckRunsCounter(MeterRegistry registry) {
        return Counter.builder("checker.runs")
                .description("Total price check runs executed")
                .register(registry);
    }

    @Bean
    public Counter priceCheckRunsSkippedCounter(MeterRegistry registry) {
        return Counter.builder("checker.runs.skipped")
                .description("Price check runs skipped because another run held the lock")
                .register(registry);
    }

    @Bean
    public Gauge budgetRemainingGauge(MeterRegistry registry, CostTracker costTracker) {
        return Gauge.builder("checker.budget.remaining", costTracker, tracker -> tracker.remainingBudget().remaining().doubleValue())
                .description("Spend still available in the current budget period")
                .register(registry);
    }
}
