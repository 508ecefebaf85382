package com.clapgrow.summary.scheduler.controller;

import com.clapgrow.summary.scheduler.dto.ApiResponse;
import com.clapgrow.summary.scheduler.dto.GroupMessagesResponse;
import com.clapgrow.summary.scheduler.dto.ScheduleRequest;
import com.clapgrow.summary.scheduler.dto.ScheduleResponse;
import com.clapgrow.summary.scheduler.service.GroupScheduleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/schedules")
@RequiredArgsConstructor
@Tag(name = "Schedules", description = "Per-group summary schedules")
public class ScheduleController {

    private final GroupScheduleService groupScheduleService;

    @GetMapping
    @Operation(summary = "List schedules", description = "Every configured group with its current task status.")
    public ResponseEntity<ApiResponse<List<ScheduleResponse>>> listSchedules() {
        return ResponseEntity.ok(ApiResponse.success(groupScheduleService.listSchedules()));
    }

    @GetMapping("/{groupId}")
    @Operation(summary = "Get schedule")
    public ResponseEntity<ApiResponse<ScheduleResponse>> getSchedule(@PathVariable String groupId) {
        return ResponseEntity.ok(ApiResponse.success(groupScheduleService.getSchedule(groupId)));
    }

    @PutMapping("/{groupId}")
    @Operation(summary = "Create or replace schedule",
            description = "Saves the group's cadence and re-enrolls it. A disabled schedule is unenrolled.")
    public ResponseEntity<ApiResponse<ScheduleResponse>> saveSchedule(@PathVariable String groupId,
                                                                      @Valid @RequestBody ScheduleRequest request) {
        return ResponseEntity.ok(ApiResponse.success(groupScheduleService.saveSchedule(groupId, request)));
    }

    @DeleteMapping("/{groupId}")
    @Operation(summary = "Delete schedule", description = "Removes the group config and unenrolls it.")
    public ResponseEntity<ApiResponse<Void>> deleteSchedule(@PathVariable String groupId) {
        groupScheduleService.deleteSchedule(groupId);
        return ResponseEntity.ok(ApiResponse.message("Schedule deleted"));
    }

    @GetMapping("/{groupId}/messages")
    @Operation(summary = "List collected messages", description = "Messages recorded from the webhook, oldest first.")
    public ResponseEntity<ApiResponse<GroupMessagesResponse>> getMessages(@PathVariable String groupId) {
        return ResponseEntity.ok(ApiResponse.success(groupScheduleService.getMessages(groupId)));
    }

    @DeleteMapping("/{groupId}/messages")
    @Operation(summary = "Clear collected messages", description = "The group's schedule is kept.")
    public ResponseEntity<ApiResponse<Integer>> clearMessages(@PathVariable String groupId) {
        int cleared = groupScheduleService.clearMessages(groupId);
        return ResponseEntity.ok(ApiResponse.success(cleared, "Messages cleared"));
    }
}
