package com.dealfinder.checker.application.job;

import com.dealfinder.checker.application.service.PriceCheckJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class PriceCheckScheduler {

    private final PriceCheckJob priceCheckJob;

    @Scheduled(cron = "${checker.schedule.cron}", zone = "${checker.schedule.zone}")
    public void scheduledRun() {
        try {
            priceCheckJob.runIfIdle()
                    .ifPresent(summary -> log.info("Scheduled price check {} finished with status {}",
                            summary.runId(), summary.status()));
        } catch (RuntimeException e) {
            log.error("Scheduled price check failed", e);
        }
    }
}
