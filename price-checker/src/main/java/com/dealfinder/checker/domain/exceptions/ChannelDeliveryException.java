package com.dealfinder.checker.domain.exceptions;

import com.dealfinder.checker.domain.notification.Channel;

public class ChannelDeliveryException extends RuntimeException {

    private ChannelDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ChannelDeliveryException of(Channel channel, String productId, Throwable cause) {
        return new ChannelDeliveryException(channel + " delivery failed for product " + productId, cause);
    }
}
