package com.dealfinder.checker.domain.detection;

import java.math.BigDecimal;

public record Decision(
        DecisionType type,
        BigDecimal oldPrice,
        BigDecimal newPrice,
        String notificationId,
        SuppressReason suppressReason
) {

    public static Decision notifyDrop(BigDecimal oldPrice, BigDecimal newPrice, String notificationId) {
        return new Decision(DecisionType.NOTIFY, oldPrice, newPrice, notificationId, null);
    }

    public static Decision suppress(SuppressReason reason, BigDecimal newPrice, String notificationId) {
        return new Decision(DecisionType.SUPPRESS, null, newPrice, notificationId, reason);
    }

    public static Decision noChange(BigDecimal newPrice) {
        return new Decision(DecisionType.NO_CHANGE, null, newPrice, null, null);
    }
}
