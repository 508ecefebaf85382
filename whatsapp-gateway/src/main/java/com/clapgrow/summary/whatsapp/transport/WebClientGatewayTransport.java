package com.clapgrow.summary.whatsapp.transport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * {@link GatewayTransport} backed by Spring's {@link WebClient}, used in blocking mode
 * because the drain loop is sequential anyway.
 */
@RequiredArgsConstructor
@Slf4j
public class WebClientGatewayTransport implements GatewayTransport {

    private final WebClient webClient;
    private final Duration responseTimeout;

    @Override
    public TransportResponse exchange(HttpMethod method, String url, Object body) {
        try {
            WebClient.RequestBodySpec spec = webClient.method(method)
                .uri(url)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
            WebClient.RequestHeadersSpec<?> request = body != null ? spec.bodyValue(body) : spec;

            TransportResponse response = request
                .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(responseBody -> new TransportResponse(clientResponse.statusCode().value(), responseBody)))
                .timeout(responseTimeout)
                .block();

            if (response == null) {
                throw new TransportException("No response received for " + method + " request");
            }
            return response;

        } catch (WebClientRequestException e) {
            throw new TransportException("Request to WhatsApp gateway failed: " + e.getMessage(), e);
        } catch (TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable unwrapped = Exceptions.unwrap(e);
            if (unwrapped instanceof TimeoutException) {
                throw new TransportException("No response from WhatsApp gateway within " + responseTimeout, unwrapped);
            }
            // statuses come back as values, so anything raised here means the exchange itself broke
            throw new TransportException("Exchange with WhatsApp gateway failed: " + unwrapped, unwrapped);
        }
    }
}
