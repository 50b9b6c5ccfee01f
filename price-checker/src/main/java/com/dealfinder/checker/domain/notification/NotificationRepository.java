package com.dealfinder.checker.domain.notification;

import java.time.Instant;
import java.util.Set;

/**
 * Domain port for the notification log. The unique {@code notification_id} is what makes dispatch
 * idempotent across retries, overlapping runs and instances.
 */
public interface NotificationRepository {

    boolean hasSentNotification(String notificationId);

    /**
     * Inserts the record as PENDING unless the id exists. An existing row is taken over only when it
     * is FAILED or a PENDING claim made before {@code staleBefore}.
     */
    ClaimResult claim(NotificationRecord record, Instant staleBefore);

    void complete(String notificationId, NotificationStatus status, Set<Channel> channels, Instant sentAt);
}
