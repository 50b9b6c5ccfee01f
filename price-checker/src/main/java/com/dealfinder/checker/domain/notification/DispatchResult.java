package com.dealfinder.checker.domain.notification;

import java.util.Map;
import java.util.Set;

/** @param failures error message per channel that did not deliver */
public record DispatchResult(
        DispatchStatus status,
        String notificationId,
        Set<Channel> delivered,
        Map<Channel, String> failures
) {

    public boolean isDelivered() {
        return status == DispatchStatus.SENT || status == DispatchStatus.PARTIALLY_FAILED;
    }
}
