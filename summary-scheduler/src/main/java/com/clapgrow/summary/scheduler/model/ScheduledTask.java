package com.clapgrow.summary.scheduler.model;

import com.clapgrow.summary.common.group.GroupConfig;

import java.time.LocalDateTime;

/**
 * Scheduling state of one enrolled group. Immutable; the scheduler replaces the
 * instance in its task map on every transition.
 *
 * @param config        group configuration the task was enrolled with
 * @param state         lifecycle state
 * @param nextRun       when the task is next due
 * @param retryCount    delivery retries performed for the current slot
 * @param lastError     error of the last failed delivery, null after a success
 * @param lastSuccessAt completion time of the last successful delivery
 * @param summarizedUntil end of the content window covered by the last successful delivery
 * @param enrollmentId  identifies the enrollment; results of older enrollments are discarded
 */
public record ScheduledTask(GroupConfig config,
                            TaskState state,
                            LocalDateTime nextRun,
                            int retryCount,
                            String lastError,
                            LocalDateTime lastSuccessAt,
                            LocalDateTime summarizedUntil,
                            long enrollmentId) {

    /**
     * @param previous task of an earlier enrollment of the same group, or null
     */
    public static ScheduledTask enrolled(GroupConfig config, LocalDateTime nextRun,
                                         ScheduledTask previous, long enrollmentId) {
        return new ScheduledTask(config, TaskState.IDLE, nextRun, 0, null,
            previous != null ? previous.lastSuccessAt() : null,
            previous != null ? previous.summarizedUntil() : null,
            enrollmentId);
    }

    public String groupId() {
        return config.groupId();
    }

    public boolean isDue(LocalDateTime now) {
        return state != TaskState.RUNNING && !now.isBefore(nextRun);
    }

    /**
     * @param provisionalNextRun next regular slot, kept if the delivery outcome is discarded
     */
    public ScheduledTask firing(LocalDateTime provisionalNextRun) {
        return new ScheduledTask(config, TaskState.RUNNING, provisionalNextRun, retryCount, lastError,
            lastSuccessAt, summarizedUntil, enrollmentId);
    }

    /**
     * @param windowEnd time the delivered content window was read up to; the next window starts there
     */
    public ScheduledTask succeeded(LocalDateTime nextRegularRun, LocalDateTime completedAt,
                                   LocalDateTime windowEnd) {
        return new ScheduledTask(config, TaskState.IDLE, nextRegularRun, 0, null, completedAt, windowEnd,
            enrollmentId);
    }

    public ScheduledTask retrying(LocalDateTime retryAt, String error) {
        return new ScheduledTask(config, TaskState.RETRYING, retryAt, retryCount + 1, error,
            lastSuccessAt, summarizedUntil, enrollmentId);
    }

    public ScheduledTask fellBack(LocalDateTime nextRegularRun, String error) {
        return new ScheduledTask(config, TaskState.IDLE, nextRegularRun, 0, error, lastSuccessAt,
            summarizedUntil, enrollmentId);
    }

    public TaskStatus toStatus() {
        return new TaskStatus(config.groupId(), config.displayName(), state, nextRun, retryCount, lastError,
            lastSuccessAt);
    }
}
