package com.clapgrow.summary.scheduler.dto;

import com.clapgrow.summary.common.group.CadenceFrequency;
import com.clapgrow.summary.common.group.GroupConfig;
import com.clapgrow.summary.scheduler.model.TaskState;
import com.clapgrow.summary.scheduler.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Group schedule together with its live task status. Status fields are null for
 * groups that are not enrolled (disabled).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleResponse(String groupId,
                               String name,
                               CadenceFrequency frequency,
                               LocalTime time,
                               DayOfWeek dayOfWeek,
                               boolean enabled,
                               TaskState state,
                               LocalDateTime nextRun,
                               Integer retryCount,
                               String lastError,
                               LocalDateTime lastSuccessAt) {

    public static ScheduleResponse of(GroupConfig config, TaskStatus status) {
        return new ScheduleResponse(
            config.groupId(),
            config.displayName(),
            config.cadence().frequency(),
            config.cadence().time(),
            config.cadence().dayOfWeek(),
            config.enabled(),
            status != null ? status.state() : null,
            status != null ? status.nextRun() : null,
            status != null ? status.retryCount() : null,
            status != null ? status.lastError() : null,
            status != null ? status.lastSuccessAt() : null);
    }
}
