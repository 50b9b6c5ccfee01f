package com.dealfinder.checker.application.controller.price.mapper;

import com.dealfinder.checker.application.controller.price.ProductOutcomeResponse;
import com.dealfinder.checker.application.controller.price.RunSummaryResponse;
import com.dealfinder.checker.domain.run.ProductOutcome;
import com.dealfinder.checker.domain.run.RunSummary;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface RunSummaryResponseMapper {

    RunSummaryResponse toResponse(RunSummary summary);

    @Mapping(target = "outcome", source = "kind")
    ProductOutcomeResponse toResponse(ProductOutcome outcome);
}
