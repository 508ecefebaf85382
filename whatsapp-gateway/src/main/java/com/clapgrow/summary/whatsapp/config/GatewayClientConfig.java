package com.clapgrow.summary.whatsapp.config;

import com.clapgrow.summary.whatsapp.service.GatewayFailureClassifier;
import com.clapgrow.summary.whatsapp.service.GreenApiGatewayClient;
import com.clapgrow.summary.whatsapp.service.Sleeper;
import com.clapgrow.summary.whatsapp.transport.GatewayTransport;
import com.clapgrow.summary.whatsapp.transport.WebClientGatewayTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
@Slf4j
public class GatewayClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public GatewayTransport gatewayTransport(WebClient greenApiWebClient, GreenApiProperties properties) {
        return new WebClientGatewayTransport(greenApiWebClient, properties.getResponseTimeout());
    }

    @Bean(destroyMethod = "close")
    public GreenApiGatewayClient gatewayClient(GatewayTransport gatewayTransport,
                                               GreenApiProperties properties,
                                               GatewayFailureClassifier failureClassifier,
                                               ObjectMapper objectMapper,
                                               Clock clock,
                                               MeterRegistry meterRegistry) {
        if (!properties.isConfigured()) {
            log.warn("Green API credentials are not configured (green-api.id-instance / green-api.api-token). "
                + "Gateway calls will be rejected by the remote service.");
        }
        return new GreenApiGatewayClient(gatewayTransport, properties, failureClassifier,
            objectMapper, clock, Sleeper.THREAD, meterRegistry);
    }
}
