package com.clapgrow.summary.scheduler.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI summarySchedulerOpenAPI(@Value("${spring.application.name:summary-scheduler}") String applicationName) {
        return new OpenAPI()
                .info(new Info()
                        .title("Group Summary Scheduler API")
                        .description(applicationName + ": per-group summary schedules, collected group messages, "
                                + "WhatsApp gateway state and the Green API webhook.")
                        .version("1.0.0"));
    }
}
