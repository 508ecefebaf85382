package com.clapgrow.summary.whatsapp.config;

import com.clapgrow.summary.common.retry.BackoffPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for the Green API WhatsApp gateway.
 *
 * Maps to:
 * green-api:
 *   base-url: https://api.green-api.com
 *   id-instance: ${GREEN_API_ID_INSTANCE}
 *   api-token: ${GREEN_API_TOKEN}
 *   min-request-interval: 1s
 *   backoff:
 *     base-delay: 6s
 *     max-delay: 60s
 *     max-retries: 3
 */
@Configuration
@ConfigurationProperties(prefix = "green-api")
@Data
public class GreenApiProperties {

    private String baseUrl = "https://api.green-api.com";

    /**
     * Gateway instance id, part of every request path.
     */
    private String idInstance;

    /**
     * Instance API token. Never logged.
     */
    private String apiToken;

    /**
     * Minimum pause between the end of one outbound call and the start of the next.
     */
    private Duration minRequestInterval = Duration.ofSeconds(1);

    private Duration responseTimeout = Duration.ofSeconds(30);

    private Duration stateCacheTtl = Duration.ofSeconds(10);

    private Duration groupsCacheTtl = Duration.ofSeconds(60);

    private Backoff backoff = new Backoff();

    public boolean isConfigured() {
        return idInstance != null && !idInstance.isBlank()
            && apiToken != null && !apiToken.isBlank();
    }

    @Data
    public static class Backoff {
        private Duration baseDelay = Duration.ofSeconds(6);
        private Duration maxDelay = Duration.ofSeconds(60);
        private int maxRetries = 3;

        public BackoffPolicy toPolicy() {
            return new BackoffPolicy(baseDelay, maxDelay, maxRetries);
        }
    }
}
