package com.dealfinder.checker.infrastructure.kafka;

import com.dealfinder.checker.domain.run.RunSummary;
import com.dealfinder.checker.domain.run.RunSummaryPublisher;
import com.dealfinder.checker.infrastructure.kafka.mapper.RunSummaryEventMapper;
import com.dealfinder.common.kafka.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RunSummaryKafkaPublisher implements RunSummaryPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final RunSummaryEventMapper mapper;

    @Override
    public void publish(RunSummary summary) {
        var event = mapper.toEvent(summary);
        kafkaTemplate.send(KafkaTopics.PRICE_CHECK_RUNS, summary.runId(), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish PriceCheckRunCompleted for run {}: {}", summary.runId(), ex.getMessage());
                    } else {
                        log.debug("Published PriceCheckRunCompleted {} for run {}", summary.status(), summary.runId());
                    }
                });
    }
}
