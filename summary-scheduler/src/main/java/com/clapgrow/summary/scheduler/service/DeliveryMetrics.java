package com.clapgrow.summary.scheduler.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Prometheus metrics for scheduled summary deliveries.
 *
 * Tracks:
 * - Summaries delivered (dry runs included)
 * - Delivery attempts that failed
 * - Failures rescheduled as a retry
 * - Slots given up after the retry budget ran out
 *
 * Counters are created once in @PostConstruct. Exposed at /actuator/prometheus.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryMetrics {

    private final MeterRegistry meterRegistry;

    private Counter deliveredCounter;
    private Counter failedCounter;
    private Counter retriedCounter;
    private Counter exhaustedCounter;

    @PostConstruct
    void init() {
        deliveredCounter = Counter.builder("summary.deliveries.delivered")
            .description("Group summaries delivered successfully")
            .register(meterRegistry);
        failedCounter = Counter.builder("summary.deliveries.failed")
            .description("Group summary delivery attempts that failed")
            .register(meterRegistry);
        retriedCounter = Counter.builder("summary.deliveries.retried")
            .description("Failed deliveries rescheduled with backoff")
            .register(meterRegistry);
        exhaustedCounter = Counter.builder("summary.deliveries.exhausted")
            .description("Deliveries abandoned for the slot after the retry budget ran out")
            .register(meterRegistry);
        log.info("Initialized delivery metrics");
    }

    public void recordDelivered() {
        deliveredCounter.increment();
    }

    public void recordFailed() {
        failedCounter.increment();
    }

    public void recordRetried() {
        retriedCounter.increment();
    }

    public void recordExhausted() {
        exhaustedCounter.increment();
    }
}
