package com.dealfinder.checker.infrastructure.db.notification;

import com.dealfinder.checker.domain.notification.NotificationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

public interface NotificationJpaRepository extends JpaRepository<NotificationRow, String> {

    @Modifying
    @Query(value = "INSERT INTO notifications (id, notification_id, product_id, old_price, new_price, currency, channels, status, claimed_at, attempts, created_at) " +
            "VALUES (:#{#row.id}, :#{#row.notificationId}, :#{#row.productId}, :#{#row.oldPrice}, :#{#row.newPrice}, :#{#row.currency}, :#{#row.channels}, :#{#row.status.name()}, :#{#row.claimedAt}, :#{#row.attempts}, :#{#row.createdAt}) " +
            "ON CONFLICT (notification_id) DO NOTHING", nativeQuery = true)
    int insertIfAbsent(NotificationRow row);

    /** Takes over a FAILED row or a PENDING claim older than {@code staleBefore}. */
    @Modifying
    @Query("UPDATE NotificationRow n SET n.status = :pending, n.claimedAt = :claimedAt, n.newPrice = :newPrice,"
            + " n.channels = '', n.sentAt = NULL, n.attempts = n.attempts + 1"
            + " WHERE n.notificationId = :notificationId"
            + " AND (n.status = :failed OR (n.status = :pending AND n.claimedAt < :staleBefore))")
    int reclaim(String notificationId, BigDecimal newPrice, Instant claimedAt, Instant staleBefore,
                NotificationStatus pending, NotificationStatus failed);

    @Modifying
    @Query("UPDATE NotificationRow n SET n.status = :status, n.channels = :channels, n.sentAt = :sentAt"
            + " WHERE n.notificationId = :notificationId")
    int complete(String notificationId, NotificationStatus status, String channels, Instant sentAt);

    boolean existsByNotificationIdAndStatus(String notificationId, NotificationStatus status);

    Optional<NotificationRow> findByNotificationId(String notificationId);
}
