package com.dealfinder.checker.domain.run;

import com.dealfinder.common.event.ErrorKind;
import com.dealfinder.common.event.OutcomeKind;
import lombok.Builder;

import java.math.BigDecimal;

@Builder(toBuilder = true)
public record ProductOutcome(
        String productId,
        OutcomeKind kind,
        ErrorKind errorKind,
        BigDecimal oldPrice,
        BigDecimal newPrice,
        String notificationId,
        String detail,
        BigDecimal spend
) {

    public static ProductOutcome cancelled(String productId) {
        return ProductOutcome.builder()
                .productId(productId)
                .kind(OutcomeKind.CANCELLED)
                .errorKind(ErrorKind.CANCELLED)
                .detail("Run deadline reached")
                .spend(BigDecimal.ZERO)
                .build();
    }
}
