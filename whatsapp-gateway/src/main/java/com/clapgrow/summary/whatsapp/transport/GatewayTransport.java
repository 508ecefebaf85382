package com.clapgrow.summary.whatsapp.transport;

import org.springframework.http.HttpMethod;

/**
 * Generic HTTP exchange used by the gateway client.
 *
 * Implementations return every HTTP status as a {@link TransportResponse}
 * (including 4xx/5xx) and raise {@link TransportException} only when no
 * response was received. Classification and retries are the client's job.
 */
@FunctionalInterface
public interface GatewayTransport {

    /**
     * @param method HTTP method
     * @param url    absolute URL
     * @param body   JSON-serializable request body, or null
     * @return status code and body
     * @throws TransportException on network-level failure
     */
    TransportResponse exchange(HttpMethod method, String url, Object body);
}
