package com.dealfinder.checker.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean(name = "searchRestTemplate")
    public RestTemplate searchRestTemplate(CheckerProperties properties) {
        var search = properties.search();
        return restTemplate(search.connectTimeout(), search.readTimeout());
    }

    @Bean(name = "llmRestTemplate")
    public RestTemplate llmRestTemplate(CheckerProperties properties) {
        var llm = properties.llm();
        return restTemplate(llm.connectTimeout(), llm.readTimeout());
    }

    private static RestTemplate restTemplate(Duration connectTimeout, Duration readTimeout) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return new RestTemplate(factory);
    }
}
