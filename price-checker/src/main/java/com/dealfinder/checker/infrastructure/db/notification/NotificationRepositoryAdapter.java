package com.dealfinder.checker.infrastructure.db.notification;

import com.dealfinder.checker.domain.notification.Channel;
import com.dealfinder.checker.domain.notification.ClaimResult;
import com.dealfinder.checker.domain.notification.NotificationRecord;
import com.dealfinder.checker.domain.notification.NotificationRepository;
import com.dealfinder.checker.domain.notification.NotificationStatus;
import com.dealfinder.common.id.UlidGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Claims rely on the unique {@code notification_id}: {@code INSERT ... ON CONFLICT DO NOTHING}
 * first, then a single conditional UPDATE for rows that may be taken over.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class NotificationRepositoryAdapter implements NotificationRepository {

    private final NotificationJpaRepository jpaRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean hasSentNotification(String notificationId) {
        return jpaRepository.existsByNotificationIdAndStatus(notificationId, NotificationStatus.SENT);
    }

    @Override
    @Transactional
    public ClaimResult claim(NotificationRecord record, Instant staleBefore) {
        var row = NotificationRow.builder()
                .id(UlidGenerator.generate())
                .notificationId(record.notificationId())
                .productId(record.productId())
                .oldPrice(record.oldPrice())
                .newPrice(record.newPrice())
                .currency(record.currency() != null ? record.currency() : "USD")
                .channels(joinChannels(record.channels()))
                .status(NotificationStatus.PENDING)
                .claimedAt(record.claimedAt())
                .attempts(Math.max(record.attempts(), 1))
                .createdAt(record.claimedAt())
                .build();

        if (jpaRepository.insertIfAbsent(row) == 1) {
            log.debug("notification.claimed: notification_id={}", record.notificationId());
            return ClaimResult.CLAIMED;
        }

        var reclaimed = jpaRepository.reclaim(record.notificationId(), record.newPrice(), record.claimedAt(),
                staleBefore, NotificationStatus.PENDING, NotificationStatus.FAILED);
        if (reclaimed == 1) {
            log.info("notification.reclaimed: notification_id={}", record.notificationId());
            return ClaimResult.CLAIMED;
        }
        return ClaimResult.ALREADY_EXISTS;
    }

    @Override
    @Transactional
    public void complete(String notificationId, NotificationStatus status, Set<Channel> channels, Instant sentAt) {
        jpaRepository.complete(notificationId, status, joinChannels(channels), sentAt);
    }

    static String joinChannels(Set<Channel> channels) {
        if (channels == null || channels.isEmpty()) {
            return "";
        }
        return channels.stream()
                .map(Channel::name)
                .sorted()
                .collect(Collectors.joining(","));
    }
}
