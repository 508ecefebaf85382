package com.clapgrow.summary.common.retry;

import java.time.Duration;

/**
 * Outcome of a {@link BackoffPolicy} consultation.
 *
 * @param outcome what the caller should do next
 * @param delay   how long to wait before retrying; {@link Duration#ZERO} unless outcome is RETRY
 */
public record BackoffDecision(Outcome outcome, Duration delay) {

    public enum Outcome {
        /** Wait {@link #delay()} and try the same work again. */
        RETRY,
        /** The attempt budget is spent. */
        EXHAUSTED,
        /** The failure class is never retried. */
        NON_RETRYABLE
    }

    public static BackoffDecision retryAfter(Duration delay) {
        return new BackoffDecision(Outcome.RETRY, delay);
    }

    public static BackoffDecision exhausted() {
        return new BackoffDecision(Outcome.EXHAUSTED, Duration.ZERO);
    }

    public static BackoffDecision nonRetryable() {
        return new BackoffDecision(Outcome.NON_RETRYABLE, Duration.ZERO);
    }

    public boolean shouldRetry() {
        return outcome == Outcome.RETRY;
    }
}
