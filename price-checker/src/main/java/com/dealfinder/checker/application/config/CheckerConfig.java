package com.dealfinder.checker.application.config;

import com.dealfinder.checker.domain.cost.BillableApi;
import com.dealfinder.checker.domain.cost.BudgetPolicy;
import com.dealfinder.checker.domain.detection.DedupPolicy;
import com.dealfinder.checker.domain.detection.DetectionPolicy;
import com.dealfinder.checker.domain.extraction.ExtractionSettings;
import com.dealfinder.checker.domain.extraction.RetryPolicy;
import com.dealfinder.checker.domain.run.RunPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Map;

/** Turns the {@code checker.*} properties into the plain policy records the domain works with. */
@Configuration
@EnableConfigurationProperties(CheckerProperties.class)
public class CheckerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BudgetPolicy budgetPolicy(CheckerProperties properties) {
        var budget = properties.budget();
        return BudgetPolicy.builder()
                .ceiling(budget.ceiling())
                .period(budget.period())
                .zone(ZoneId.of(budget.zone()))
                .estimates(Map.of(
                        BillableApi.SEARCH, budget.searchEstimate(),
                        BillableApi.LLM_EXTRACTION, budget.llmEstimate()))
                .build();
    }

    @Bean
    public DedupPolicy dedupPolicy(CheckerProperties properties) {
        var dedup = properties.dedup();
        return new DedupPolicy(dedup.window(), dedup.priceBucket(), dedup.pendingClaimTimeout());
    }

    @Bean
    public DetectionPolicy detectionPolicy(CheckerProperties properties) {
        return new DetectionPolicy(properties.detection().volatilityThreshold());
    }

    @Bean
    public RetryPolicy retryPolicy(CheckerProperties properties) {
        var retry = properties.retry();
        return new RetryPolicy(retry.maxAttempts(), retry.initialBackoff(), retry.multiplier());
    }

    @Bean
    public ExtractionSettings extractionSettings(CheckerProperties properties) {
        return new ExtractionSettings(properties.search().maxResults(), properties.llm().maxSourceChars());
    }

    @Bean
    public RunPolicy runPolicy(CheckerProperties properties) {
        return new RunPolicy(properties.workers().runTimeout());
    }
}
