package com.clapgrow.summary.scheduler.controller;

import com.clapgrow.summary.scheduler.dto.ApiResponse;
import com.clapgrow.summary.scheduler.dto.WebhookNotification;
import com.clapgrow.summary.scheduler.service.WebhookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/whatsapp/webhook")
@RequiredArgsConstructor
@Tag(name = "Webhook", description = "Incoming notifications from the WhatsApp gateway")
public class WebhookController {

    private final WebhookService webhookService;

    /**
     * Always acknowledged with 200 so the gateway does not redeliver ignored notifications.
     */
    @PostMapping
    @Operation(summary = "Receive gateway notification",
            description = "Records text messages of configured groups; other notifications are acknowledged and ignored.")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> receive(@RequestBody WebhookNotification notification) {
        boolean recorded = webhookService.handle(notification);
        return ResponseEntity.ok(ApiResponse.success(Map.of("recorded", recorded)));
    }
}
