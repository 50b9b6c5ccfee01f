package com.dealfinder.checker.infrastructure.kafka.mapper;

import com.dealfinder.checker.domain.run.ProductOutcome;
import com.dealfinder.checker.domain.run.RunSummary;
import com.dealfinder.common.event.PriceCheckRunCompleted;
import com.dealfinder.common.event.ProductOutcomeEvent;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface RunSummaryEventMapper {

    PriceCheckRunCompleted toEvent(RunSummary summary);

    @Mapping(target = "outcome", source = "kind")
    ProductOutcomeEvent toEvent(ProductOutcome outcome);
}
