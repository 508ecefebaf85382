package com.clapgrow.summary.scheduler.exception;

public class ScheduleNotFoundException extends RuntimeException {

    public ScheduleNotFoundException(String groupId) {
        super("No schedule configured for group " + groupId);
    }
}
