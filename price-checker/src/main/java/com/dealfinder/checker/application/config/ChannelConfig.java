package com.dealfinder.checker.application.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sns.SnsClient;

@Configuration
public class ChannelConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "checker.channels.sms.enabled", havingValue = "true")
    public SnsClient snsClient(CheckerProperties properties) {
        return SnsClient.builder()
                .region(Region.of(properties.channels().sms().region()))
                .build();
    }
}
