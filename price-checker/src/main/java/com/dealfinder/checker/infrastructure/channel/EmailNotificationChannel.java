package com.dealfinder.checker.infrastructure.channel;

import com.dealfinder.checker.application.config.CheckerProperties;
import com.dealfinder.checker.domain.exceptions.ChannelDeliveryException;
import com.dealfinder.checker.domain.notification.Channel;
import com.dealfinder.checker.domain.notification.NotificationChannel;
import com.dealfinder.checker.domain.notification.PriceDropMessage;
import com.dealfinder.checker.domain.product.TrackedProduct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(name = "checker.channels.email.enabled", havingValue = "true")
public class EmailNotificationChannel implements NotificationChannel {

    private final JavaMailSender mailSender;
    private final String from;

    public EmailNotificationChannel(JavaMailSender mailSender, CheckerProperties properties) {
        this.mailSender = mailSender;
        this.from = properties.channels().email().from();
    }

    @Override
    public Channel channel() {
        return Channel.EMAIL;
    }

    @Override
    public boolean canDeliverTo(TrackedProduct product) {
        return product.subscriberEmail() != null && !product.subscriberEmail().isBlank();
    }

    @Override
    public void send(TrackedProduct product, PriceDropMessage message) {
        var mail = new SimpleMailMessage();
        mail.setFrom(from);
        mail.setTo(product.subscriberEmail());
        mail.setSubject(message.subject());
        mail.setText(message.body());
        try {
            mailSender.send(mail);
            log.debug("Price drop email sent for product {}", product.productId());
        } catch (MailException e) {
            throw ChannelDeliveryException.of(Channel.EMAIL, product.productId(), e);
        }
    }
}
