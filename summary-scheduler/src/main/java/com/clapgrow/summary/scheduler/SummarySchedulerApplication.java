package com.clapgrow.summary.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.web.reactive.WebFluxAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

// WebFlux is on the classpath only for the gateway's WebClient; the control surface is servlet based
@SpringBootApplication(scanBasePackages = "com.clapgrow.summary", exclude = WebFluxAutoConfiguration.class)
@EnableScheduling
public class SummarySchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SummarySchedulerApplication.class, args);
    }
}
