package com.dealfinder.checker.application.controller.price;

import com.dealfinder.checker.application.controller.price.mapper.RunSummaryResponseMapper;
import com.dealfinder.checker.application.service.PriceCheckJob;
import com.dealfinder.checker.domain.exceptions.RunAlreadyInProgressException;
import com.dealfinder.common.event.RunStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Manual trigger for a price check run; answers once the run is summarized. */
@RestController
@RequestMapping("/api/v1/price-checks")
@RequiredArgsConstructor
public class PriceCheckController {

    private final PriceCheckJob priceCheckJob;
    private final RunSummaryResponseMapper mapper;

    @PostMapping
    public ResponseEntity<RunSummaryResponse> triggerRun() {
        var summary = priceCheckJob.runIfIdle()
                .orElseThrow(RunAlreadyInProgressException::of);
        var status = summary.status() == RunStatus.FAILED ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.OK;
        return ResponseEntity.status(status).body(mapper.toResponse(summary));
    }
}
