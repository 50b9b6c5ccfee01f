package com.dealfinder.checker.application.controller.price;

import com.dealfinder.common.event.ErrorKind;
import com.dealfinder.common.event.OutcomeKind;

import java.math.BigDecimal;

public record ProductOutcomeResponse(
        String productId,
        OutcomeKind outcome,
        ErrorKind errorKind,
        BigDecimal oldPrice,
        BigDecimal newPrice,
        String notificationId,
        String detail,
        BigDecimal spend) {}
