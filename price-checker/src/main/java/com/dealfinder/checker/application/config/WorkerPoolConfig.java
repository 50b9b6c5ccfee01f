package com.dealfinder.checker.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fixed pool that processes the products of a run. Its size bounds concurrent provider calls and
 * the database connections the workers hold, so keep it below the Hikari pool size.
 */
@Configuration
public class WorkerPoolConfig {

    @Bean(name = "priceCheckWorkerPool", destroyMethod = "shutdownNow")
    public ExecutorService priceCheckWorkerPool(CheckerProperties properties) {
        return Executors.newFixedThreadPool(
                properties.workers().poolSize(), new CustomizableThreadFactory("price-check-"));
    }
}
