package com.clapgrow.summary.whatsapp.service;

import org.springframework.http.HttpMethod;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound call waiting in the gateway queue. Owned by the client until its
 * completion is resolved.
 *
 * @param endpoint         gateway method name, e.g. {@code sendMessage}
 * @param method           HTTP method
 * @param payload          request body, or null
 * @param retryThrottling  whether a 429 is retried in place or rejected at once
 * @param completion       resolved with the response body or a GatewayException
 */
record QueuedRequest(String endpoint,
                     HttpMethod method,
                     Object payload,
                     boolean retryThrottling,
                     CompletableFuture<String> completion) {

    static QueuedRequest of(String endpoint, HttpMethod method, Object payload, boolean retryThrottling) {
        return new QueuedRequest(endpoint, method, payload, retryThrottling, new CompletableFuture<>());
    }
}
