package com.dealfinder.checker.domain.run;

import com.dealfinder.checker.domain.cost.CostTracker;
import com.dealfinder.checker.domain.product.ProductRepository;
import com.dealfinder.checker.domain.product.TrackedProduct;
import com.dealfinder.common.event.ErrorKind;
import com.dealfinder.common.event.OutcomeKind;
import com.dealfinder.common.event.RunStatus;
import com.dealfinder.common.id.UlidGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One price check run: load the tracked products, process them on the worker pool, and summarize.
 *
 * <p>Each product yields exactly one outcome. Work still running at the run deadline is
 * interrupted and reported as CANCELLED; the other outcomes stand. Only failing to read the product
 * list fails the run as a whole.
 */
@Slf4j
@Service
public class RunOrchestrator {

    private final ProductRepository productRepository;
    private final ProductProcessor productProcessor;
    private final CostTracker costTracker;
    private final RunSummaryPublisher summaryPublisher;
    private final ExecutorService workerPool;
    private final RunPolicy runPolicy;
    private final Clock clock;

    public RunOrchestrator(
            ProductRepository productRepository,
            ProductProcessor productProcessor,
            CostTracker costTracker,
            RunSummaryPublisher summaryPublisher,
            @Qualifier("priceCheckWorkerPool") ExecutorService workerPool,
            RunPolicy runPolicy,
            Clock clock) {
        this.productRepository = productRepository;
        this.productProcessor = productProcessor;
        this.costTracker = costTracker;
        this.summaryPublisher = summaryPublisher;
        this.workerPool = workerPool;
        this.runPolicy = runPolicy;
        this.clock = clock;
    }

    public RunSummary run() {
        var runId = UlidGenerator.generate(clock);
        var startedAt = clock.instant();
        log.info("price_check.run.started: run_id={}", runId);

        List<TrackedProduct> products;
        try {
            products = productRepository.listTrackedProducts();
        } catch (RuntimeException e) {
            log.error("price_check.run.failed: run_id={}, reason=product list unavailable", runId, e);
            var summary = RunSummary.of(runId, RunStatus.FAILED, startedAt, clock.instant(), List.of(), remainingBudget());
            publish(summary);
            return summary;
        }

        var outcomes = collect(submitAll(products), products);
        var status = outcomes.stream().anyMatch(o -> o.kind() == OutcomeKind.CANCELLED)
                ? RunStatus.CANCELLED
                : RunStatus.COMPLETED;

        var summary = RunSummary.of(runId, status, startedAt, clock.instant(), outcomes, remainingBudget());
        log.info("price_check.run.completed: run_id={}, status={}, processed={}, notified={}, suppressed={}, "
                        + "no_change={}, extraction_failed={}, budget_skipped={}, failed={}, spend={}",
                runId, status, summary.productsProcessed(), summary.notified(), summary.suppressed(),
                summary.noChange(), summary.extractionFailed(), summary.budgetSkipped(), summary.failed(),
                summary.totalSpend());
        publish(summary);
        return summary;
    }

    private List<Future<ProductOutcome>> submitAll(List<TrackedProduct> products) {
        var futures = new ArrayList<Future<ProductOutcome>>(products.size());
        for (var product : products) {
            futures.add(workerPool.submit(() -> productProcessor.process(product)));
        }
        return futures;
    }

    private List<ProductOutcome> collect(List<Future<ProductOutcome>> futures, List<TrackedProduct> products) {
        var deadline = System.nanoTime() + runPolicy.runTimeout().toNanos();
        var outcomes = new ArrayList<ProductOutcome>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            var future = futures.get(i);
            var productId = products.get(i).productId();
            try {
                var remaining = deadline - System.nanoTime();
                if (!future.isDone() && remaining <= 0) {
                    throw new TimeoutException();
                }
                outcomes.add(future.get(Math.max(remaining, 0), TimeUnit.NANOSECONDS));
            } catch (TimeoutException | CancellationException e) {
                future.cancel(true);
                log.warn("price_check.product.cancelled: product_id={}", productId);
                outcomes.add(ProductOutcome.cancelled(productId));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                outcomes.add(ProductOutcome.cancelled(productId));
            } catch (ExecutionException e) {
                log.error("price_check.product.crashed: product_id={}", productId, e.getCause());
                outcomes.add(ProductOutcome.builder()
                        .productId(productId)
                        .kind(OutcomeKind.ERROR)
                        .errorKind(ErrorKind.UNEXPECTED)
                        .detail(String.valueOf(e.getCause()))
                        .spend(BigDecimal.ZERO)
                        .build());
            }
        }
        return outcomes;
    }

    private BigDecimal remainingBudget() {
        try {
            return costTracker.remainingBudget().remaining();
        } catch (RuntimeException e) {
            log.warn("price_check.budget_unavailable: {}", e.getMessage());
            return null;
        }
    }

    private void publish(RunSummary summary) {
        try {
            summaryPublisher.publish(summary);
        } catch (RuntimeException e) {
            log.warn("price_check.summary_publish_failed: run_id={}", summary.runId(), e);
        }
    }
}
