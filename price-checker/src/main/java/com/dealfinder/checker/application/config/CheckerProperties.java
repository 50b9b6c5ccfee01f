package com.dealfinder.checker.application.config;

import com.dealfinder.checker.domain.cost.BudgetPeriod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "checker")
public record CheckerProperties(
        @NotNull @Valid Schedule schedule,
        @NotNull @Valid Budget budget,
        @NotNull @Valid Dedup dedup,
        @NotNull @Valid Detection detection,
        @NotNull @Valid Retry retry,
        @NotNull @Valid Workers workers,
        @NotNull @Valid Search search,
        @NotNull @Valid Llm llm,
        @NotNull @Valid Channels channels) {

    public record Schedule(@NotBlank String cron, @NotBlank String zone) {}

    public record Budget(
            @NotNull @DecimalMin("0.00") BigDecimal ceiling,
            @NotNull BudgetPeriod period,
            @NotBlank String zone,
            @NotNull @DecimalMin("0.00") BigDecimal searchEstimate,
            @NotNull @DecimalMin("0.00") BigDecimal llmEstimate) {}

    public record Dedup(
            @NotNull @DurationMin(seconds = 1) Duration window,
            @NotNull @DecimalMin("0.01") BigDecimal priceBucket,
            @NotNull @DurationMin(seconds = 1) Duration pendingClaimTimeout) {}

    public record Detection(@NotNull @DecimalMin("0.00") BigDecimal volatilityThreshold) {}

    public record Retry(@Min(1) int maxAttempts, @NotNull Duration initialBackoff, @DecimalMin("1.0") double multiplier) {}

    public record Workers(@Min(1) int poolSize, @NotNull Duration runTimeout) {}

    public record Search(
            @NotBlank String baseUrl,
            String apiKey,
            @Min(1) int maxResults,
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout) {}

    public record Llm(
            @NotBlank String baseUrl,
            String apiKey,
            @NotBlank String model,
            @Min(200) int maxSourceChars,
            @NotNull @DecimalMin("0.00") BigDecimal inputCostPer1kTokens,
            @NotNull @DecimalMin("0.00") BigDecimal outputCostPer1kTokens,
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout) {}

    public record Channels(@NotNull @Valid Email email, @NotNull @Valid Sms sms) {

        public record Email(boolean enabled, String from) {}

        public record Sms(boolean enabled, String region, String senderId) {}
    }
}
