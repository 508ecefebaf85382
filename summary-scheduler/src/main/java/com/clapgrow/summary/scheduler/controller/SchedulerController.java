package com.clapgrow.summary.scheduler.controller;

import com.clapgrow.summary.scheduler.dto.ApiResponse;
import com.clapgrow.summary.scheduler.service.DeliveryScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/scheduler")
@RequiredArgsConstructor
@Tag(name = "Scheduler", description = "Delivery scheduler control")
public class SchedulerController {

    private final DeliveryScheduler deliveryScheduler;

    @GetMapping
    @Operation(summary = "Scheduler status")
    public ResponseEntity<ApiResponse<Map<String, Object>>> status() {
        return ResponseEntity.ok(ApiResponse.success(Map.of(
                "running", deliveryScheduler.isRunning(),
                "enrolledGroups", deliveryScheduler.listTaskStatuses().size())));
    }

    @PostMapping("/start")
    @Operation(summary = "Start evaluating schedules")
    public ResponseEntity<ApiResponse<Map<String, Object>>> start() {
        deliveryScheduler.start();
        return ResponseEntity.ok(ApiResponse.success(Map.of("running", deliveryScheduler.isRunning()),
                "Scheduler started"));
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop evaluating schedules", description = "Enrollments are kept; running deliveries complete.")
    public ResponseEntity<ApiResponse<Map<String, Object>>> stop() {
        deliveryScheduler.stop();
        return ResponseEntity.ok(ApiResponse.success(Map.of("running", deliveryScheduler.isRunning()),
                "Scheduler stopped"));
    }
}
