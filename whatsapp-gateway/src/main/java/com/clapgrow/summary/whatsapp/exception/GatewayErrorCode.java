package com.clapgrow.summary.whatsapp.exception;

/**
 * Error codes surfaced to callers of the gateway client.
 */
public enum GatewayErrorCode {
    /** Account session is not authorized; requires re-scanning the QR code. Never retried. */
    NOT_AUTHORIZED,
    /** Throttling persisted through every backoff attempt. */
    RATE_LIMITED,
    /** Group summary target is not a canonical group chat id. */
    INVALID_GROUP_ID,
    /** Identifier could not be normalized. */
    INVALID_IDENTIFIER,
    EMPTY_IDENTIFIER,
    EMPTY_MESSAGE,
    /** Network-level failure, or 5xx responses that outlasted the backoff budget. */
    TRANSPORT_ERROR,
    /** Delivery retries ran out; used by the scheduler when falling back to the next slot. */
    EXHAUSTED,
    /** Remote rejected the request as malformed (4xx other than 401, 403 and 429). Never retried. */
    REQUEST_REJECTED,
    /** Successful status with a body that could not be understood. */
    INVALID_RESPONSE
}
