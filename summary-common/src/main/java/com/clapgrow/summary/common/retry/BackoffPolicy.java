package com.clapgrow.summary.common.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff with a cap and a bounded attempt count.
 *
 * <p>For retryable classifications the delay for attempt {@code a} is
 * {@code min(baseDelay * 2^a, maxDelay)} while {@code a < maxRetries}; from
 * {@code a == maxRetries} on the policy answers EXHAUSTED. PERMANENT failures
 * are answered with NON_RETRYABLE regardless of the attempt.
 *
 * <p>Pure and immutable: one instance can be shared by any number of callers.
 *
 * @param baseDelay  delay before the first retry
 * @param maxDelay   upper bound for any single delay
 * @param maxRetries number of retries allowed after the initial attempt
 */
public record BackoffPolicy(Duration baseDelay, Duration maxDelay, int maxRetries) {

    public BackoffPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }

    /**
     * Gateway call policy: 6s, 12s, 24s, then exhausted.
     */
    public static BackoffPolicy gatewayDefaults() {
        return new BackoffPolicy(Duration.ofSeconds(6), Duration.ofSeconds(60), 3);
    }

    /**
     * Scheduled delivery policy: 5m, 10m, 20m, then exhausted.
     */
    public static BackoffPolicy deliveryDefaults() {
        return new BackoffPolicy(Duration.ofMinutes(5), Duration.ofMinutes(60), 3);
    }

    /**
     * Decide what to do after a failed attempt.
     *
     * @param attempt    number of retries already performed (0 after the first failure)
     * @param errorClass classification of the failure
     * @return retry delay, EXHAUSTED or NON_RETRYABLE
     */
    public BackoffDecision nextDelay(int attempt, FailureClassification errorClass) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        Objects.requireNonNull(errorClass, "errorClass");
        if (!errorClass.isRetryable()) {
            return BackoffDecision.nonRetryable();
        }
        if (attempt >= maxRetries) {
            return BackoffDecision.exhausted();
        }
        // shift capped so the multiplication cannot overflow for large retry budgets
        Duration delay = baseDelay.multipliedBy(1L << Math.min(attempt, 30));
        return BackoffDecision.retryAfter(delay.compareTo(maxDelay) > 0 ? maxDelay : delay);
    }
}
