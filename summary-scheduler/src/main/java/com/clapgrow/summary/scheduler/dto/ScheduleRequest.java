package com.clapgrow.summary.scheduler.dto;

import com.clapgrow.summary.common.group.CadenceFrequency;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.time.DayOfWeek;

@Data
public class ScheduleRequest {

    private String name;

    @NotNull(message = "Frequency is required")
    private CadenceFrequency frequency;

    @NotNull(message = "Time is required")
    @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$", message = "Time must be in HH:mm format")
    private String time;

    // Required for WEEKLY, must be absent for DAILY
    private DayOfWeek dayOfWeek;

    private boolean enabled = true;
}
