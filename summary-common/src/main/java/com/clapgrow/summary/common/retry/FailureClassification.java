package com.clapgrow.summary.common.retry;

/**
 * Classification of outbound call and delivery failures.
 *
 * Used to determine retry behavior:
 * - PERMANENT: Never retried (authorization failures, malformed requests, local validation)
 * - TRANSIENT: Retried with exponential backoff (network errors, 5xx responses)
 * - RATE_LIMIT: Retried with exponential backoff (429 Too Many Requests)
 *
 * Shared by the gateway drain loop and the delivery scheduler so both
 * layers agree on what is worth retrying.
 */
public enum FailureClassification {
    PERMANENT,
    TRANSIENT,
    RATE_LIMIT;

    public boolean isRetryable() {
        return this != PERMANENT;
    }
}
