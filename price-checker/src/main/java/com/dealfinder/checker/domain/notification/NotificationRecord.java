package com.dealfinder.checker.domain.notification;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

@Builder(toBuilder = true)
public record NotificationRecord(
        String notificationId,
        String productId,
        BigDecimal oldPrice,
        BigDecimal newPrice,
        String currency,
        Set<Channel> channels,
        NotificationStatus status,
        Instant claimedAt,
        Instant sentAt,
        int attempts
) {}
