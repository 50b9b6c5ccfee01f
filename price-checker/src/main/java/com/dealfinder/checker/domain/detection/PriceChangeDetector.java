package com.dealfinder.checker.domain.detection;

import com.dealfinder.checker.domain.extraction.Confidence;
import com.dealfinder.checker.domain.extraction.PriceObservation;
import com.dealfinder.checker.domain.notification.NotificationRepository;
import com.dealfinder.checker.domain.product.TrackedProduct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Decides whether an observation is worth a notification. A drop below the last known price or a
 * first crossing of the target price notifies; LOW-confidence readings that move too far are
 * distrusted; a drop already notified in the current window is a duplicate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceChangeDetector {

    private final NotificationRepository notificationRepository;
    private final DetectionPolicy detectionPolicy;
    private final DedupPolicy dedupPolicy;

    public Decision decide(TrackedProduct product, PriceObservation observation) {
        var observed = observation.observedPrice();
        var last = product.lastKnownPrice();
        var isDrop = last != null && observed.compareTo(last) < 0;
        var crossesTarget = crossesTarget(product, observed);

        if (observation.confidence() == Confidence.LOW) {
            var distrusted = last != null ? deviatesTooFar(last, observed) : crossesTarget;
            if (distrusted) {
                log.info("detection.suppressed: product_id={}, reason=LOW_CONFIDENCE, last={}, observed={}",
                        product.productId(), last, observed);
                return Decision.suppress(SuppressReason.LOW_CONFIDENCE, observed, null);
            }
        }

        if (!isDrop && !crossesTarget) {
            return Decision.noChange(observed);
        }

        var notificationId = NotificationKeys.of(product.productId(), observed, observation.observedAt(), dedupPolicy);
        if (notificationRepository.hasSentNotification(notificationId)) {
            log.info("detection.suppressed: product_id={}, reason=DUPLICATE, notification_id={}",
                    product.productId(), notificationId);
            return Decision.suppress(SuppressReason.DUPLICATE, observed, notificationId);
        }
        return Decision.notifyDrop(last, observed, notificationId);
    }

    private static boolean crossesTarget(TrackedProduct product, BigDecimal observed) {
        var target = product.targetPrice();
        if (target == null || observed.compareTo(target) > 0) {
            return false;
        }
        return product.lastKnownPrice() == null || product.lastKnownPrice().compareTo(target) > 0;
    }

    private boolean deviatesTooFar(BigDecimal last, BigDecimal observed) {
        if (last.signum() == 0) {
            return observed.signum() != 0;
        }
        var deviation = observed.subtract(last).abs().divide(last, MathContext.DECIMAL64);
        return deviation.compareTo(detectionPolicy.volatilityThreshold()) > 0;
    }
}
