package com.dealfinder.checker.infrastructure.channel;

import com.dealfinder.checker.application.config.CheckerProperties;
import com.dealfinder.checker.domain.exceptions.ChannelDeliveryException;
import com.dealfinder.checker.domain.notification.Channel;
import com.dealfinder.checker.domain.notification.NotificationChannel;
import com.dealfinder.checker.domain.notification.PriceDropMessage;
import com.dealfinder.checker.domain.product.TrackedProduct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;

import java.util.HashMap;

/** Direct-to-phone SMS through SNS; the message is the mail body, as SMS has no subject. */
@Slf4j
@Component
@ConditionalOnProperty(name = "checker.channels.sms.enabled", havingValue = "true")
public class SmsNotificationChannel implements NotificationChannel {

    private final SnsClient snsClient;
    private final String senderId;

    public SmsNotificationChannel(SnsClient snsClient, CheckerProperties properties) {
        this.snsClient = snsClient;
        this.senderId = properties.channels().sms().senderId();
    }

    @Override
    public Channel channel() {
        return Channel.SMS;
    }

    @Override
    public boolean canDeliverTo(TrackedProduct product) {
        return product.subscriberPhone() != null && !product.subscriberPhone().isBlank();
    }

    @Override
    public void send(TrackedProduct product, PriceDropMessage message) {
        var attributes = new HashMap<String, MessageAttributeValue>();
        attributes.put("AWS.SNS.SMS.SMSType", stringAttribute("Transactional"));
        if (senderId != null && !senderId.isBlank()) {
            attributes.put("AWS.SNS.SMS.SenderID", stringAttribute(senderId));
        }
        var request = PublishRequest.builder()
                .phoneNumber(product.subscriberPhone())
                .message(message.body())
                .messageAttributes(attributes)
                .build();
        try {
            var response = snsClient.publish(request);
            log.debug("Price drop SMS sent for product {}: message_id={}", product.productId(), response.messageId());
        } catch (SdkException e) {
            throw ChannelDeliveryException.of(Channel.SMS, product.productId(), e);
        }
    }

    private static MessageAttributeValue stringAttribute(String value) {
        return MessageAttributeValue.builder().dataType("String").stringValue(value).build();
    }
}
