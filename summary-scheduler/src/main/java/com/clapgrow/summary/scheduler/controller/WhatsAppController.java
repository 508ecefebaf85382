package com.clapgrow.summary.scheduler.controller;

import com.clapgrow.summary.scheduler.dto.ApiResponse;
import com.clapgrow.summary.scheduler.dto.SendMessageRequest;
import com.clapgrow.summary.whatsapp.model.InstanceState;
import com.clapgrow.summary.whatsapp.model.SendMessageResult;
import com.clapgrow.summary.whatsapp.model.WhatsAppGroup;
import com.clapgrow.summary.whatsapp.service.GatewayClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/whatsapp")
@RequiredArgsConstructor
@Tag(name = "WhatsApp", description = "WhatsApp gateway state, groups and ad-hoc messages")
public class WhatsAppController {

    private final GatewayClient gatewayClient;

    @GetMapping("/state")
    @Operation(summary = "Gateway instance state",
            description = "Authorization state of the WhatsApp account. A throttled check is reported as AUTHORIZED.")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getState() {
        InstanceState state = gatewayClient.getInstanceState();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", state);
        body.put("configured", gatewayClient.isConfigured());
        return ResponseEntity.ok(ApiResponse.success(body));
    }

    @GetMapping("/groups")
    @Operation(summary = "List groups", description = "Group chats visible to the WhatsApp account (cached for a minute).")
    public ResponseEntity<ApiResponse<List<WhatsAppGroup>>> listGroups() {
        return ResponseEntity.ok(ApiResponse.success(gatewayClient.listGroups()));
    }

    @PostMapping("/messages")
    @Operation(summary = "Send a message", description = "Sends a text message to a chat id; bare numbers are normalized.")
    public ResponseEntity<ApiResponse<SendMessageResult>> sendMessage(@RequestBody SendMessageRequest request) {
        SendMessageResult result = gatewayClient.sendMessage(request.getChatId(), request.getMessage());
        return ResponseEntity.ok(ApiResponse.success(result, "Message sent"));
    }
}
