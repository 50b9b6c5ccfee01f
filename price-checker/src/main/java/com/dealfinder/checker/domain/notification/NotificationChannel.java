package com.dealfinder.checker.domain.notification;

import com.dealfinder.checker.domain.product.TrackedProduct;

public interface NotificationChannel {

    Channel channel();

    /** Whether the product has a recipient for this channel. */
    boolean canDeliverTo(TrackedProduct product);

    /** @throws com.dealfinder.checker.domain.exceptions.ChannelDeliveryException when delivery fails */
    void send(TrackedProduct product, PriceDropMessage message);
}
