package com.clapgrow.summary.scheduler.controller;

import com.clapgrow.summary.scheduler.service.DeliveryScheduler;
import com.clapgrow.summary.whatsapp.service.GatewayClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Health check endpoints")
public class HealthController {

    private final DeliveryScheduler deliveryScheduler;
    private final GatewayClient gatewayClient;

    @GetMapping("/api/v1/health")
    @Operation(
            summary = "Health check",
            description = "Returns the health status of the summary scheduler. Does not call the gateway."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Service is healthy")
    })
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("service", "summary-scheduler");
        response.put("schedulerRunning", deliveryScheduler.isRunning());
        response.put("gatewayConfigured", gatewayClient.isConfigured());
        return ResponseEntity.ok(response);
    }
}
