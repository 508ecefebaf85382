package com.clapgrow.summary.whatsapp.transport;

/**
 * Network-level failure: connection refused or reset, DNS failure, response timeout.
 * Raised by {@link GatewayTransport} when no HTTP status was obtained.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
