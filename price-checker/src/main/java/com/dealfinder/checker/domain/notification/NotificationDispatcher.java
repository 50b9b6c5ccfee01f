package com.dealfinder.checker.domain.notification;

import com.dealfinder.checker.domain.detection.DedupPolicy;
import com.dealfinder.checker.domain.detection.Decision;
import com.dealfinder.checker.domain.product.TrackedProduct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Delivers a price-drop notification at most once per notification id.
 *
 * <p>The id is claimed as PENDING before anything is sent. Channels are tried independently; the
 * row ends SENT when at least one delivered and FAILED otherwise, so a later run may reclaim it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final NotificationRepository notificationRepository;
    private final List<NotificationChannel> channels;
    private final DedupPolicy dedupPolicy;
    private final Clock clock;

    public DispatchResult dispatch(TrackedProduct product, Decision decision) {
        var notificationId = decision.notificationId();
        var targets = channels.stream()
                .filter(channel -> channel.canDeliverTo(product))
                .toList();
        if (targets.isEmpty()) {
            log.warn("notification.no_channel: product_id={}, notification_id={}", product.productId(), notificationId);
            return new DispatchResult(DispatchStatus.FAILED, notificationId, Set.of(), Map.of());
        }

        var now = clock.instant();
        var record = NotificationRecord.builder()
                .notificationId(notificationId)
                .productId(product.productId())
                .oldPrice(decision.oldPrice())
                .newPrice(decision.newPrice())
                .currency(product.currency())
                .channels(Set.of())
                .status(NotificationStatus.PENDING)
                .claimedAt(now)
                .attempts(1)
                .build();
        var claim = notificationRepository.claim(record, now.minus(dedupPolicy.pendingClaimTimeout()));
        if (claim == ClaimResult.ALREADY_EXISTS) {
            log.info("notification.suppressed: product_id={}, notification_id={}", product.productId(), notificationId);
            return new DispatchResult(DispatchStatus.SUPPRESSED, notificationId, Set.of(), Map.of());
        }

        var message = PriceDropMessage.of(product, decision.oldPrice(), decision.newPrice());
        Set<Channel> delivered = EnumSet.noneOf(Channel.class);
        Map<Channel, String> failures = new EnumMap<>(Channel.class);
        for (var channel : targets) {
            try {
                channel.send(product, message);
                delivered.add(channel.channel());
            } catch (RuntimeException e) {
                log.warn("notification.channel_failed: product_id={}, channel={}, reason={}",
                        product.productId(), channel.channel(), e.getMessage());
                failures.put(channel.channel(), e.getMessage());
            }
        }

        var status = delivered.isEmpty() ? NotificationStatus.FAILED : NotificationStatus.SENT;
        var sentAt = delivered.isEmpty() ? null : clock.instant();
        try {
            notificationRepository.complete(notificationId, status, delivered, sentAt);
        } catch (RuntimeException e) {
            // the claim stays PENDING and becomes reclaimable after the claim timeout
            log.error("notification.complete_failed: notification_id={}, status={}", notificationId, status, e);
        }

        var result = new DispatchResult(dispatchStatus(delivered, failures), notificationId, delivered, failures);
        log.info("notification.dispatched: product_id={}, notification_id={}, status={}, channels={}",
                product.productId(), notificationId, result.status(), delivered);
        return result;
    }

    private static DispatchStatus dispatchStatus(Set<Channel> delivered, Map<Channel, String> failures) {
        if (delivered.isEmpty()) {
            return DispatchStatus.FAILED;
        }
        return failures.isEmpty() ? DispatchStatus.SENT : DispatchStatus.PARTIALLY_FAILED;
    }
}
