package com.clapgrow.summary.whatsapp.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient for the Green API gateway.
 * Uses the Reactor Netty HTTP client only; no reactive server is started.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient greenApiWebClient(GreenApiProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getResponseTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
    }
}
