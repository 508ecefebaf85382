package com.clapgrow.summary.scheduler.config;

import com.clapgrow.summary.common.retry.BackoffPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for scheduled summary delivery.
 *
 * Maps to:
 * summary:
 *   scheduler:
 *     poll-interval-ms: 60000
 *     delivery-threads: 4
 *     auto-start: true
 *     dry-run: false
 *     retry:
 *       base-delay: 5m
 *       max-delay: 60m
 *       max-retries: 3
 */
@Configuration
@ConfigurationProperties(prefix = "summary.scheduler")
@Data
public class SchedulerProperties {

    /**
     * How often due tasks are evaluated. Read by the @Scheduled trigger.
     */
    private long pollIntervalMs = 60_000;

    private int deliveryThreads = 4;

    /**
     * Whether evaluation is active right after startup.
     */
    private boolean autoStart = true;

    /**
     * Produce and log summaries without sending them.
     */
    private boolean dryRun = false;

    private Retry retry = new Retry();

    @Data
    public static class Retry {
        private Duration baseDelay = Duration.ofMinutes(5);
        private Duration maxDelay = Duration.ofMinutes(60);
        private int maxRetries = 3;

        public BackoffPolicy toPolicy() {
            return new BackoffPolicy(baseDelay, maxDelay, maxRetries);
        }
    }
}
