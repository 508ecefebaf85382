package com.clapgrow.summary.scheduler.config;

import com.clapgrow.summary.common.retry.BackoffPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class SchedulerConfig {

    /**
     * Runs summary deliveries. Deliveries for different groups may overlap; the gateway
     * client's queue serializes their outbound calls.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor(SchedulerProperties properties) {
        AtomicInteger threadNumber = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "summary-delivery-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Creating delivery executor with {} threads", properties.getDeliveryThreads());
        return Executors.newFixedThreadPool(properties.getDeliveryThreads(), threadFactory);
    }

    @Bean
    public BackoffPolicy deliveryBackoffPolicy(SchedulerProperties properties) {
        return properties.getRetry().toPolicy();
    }
}
