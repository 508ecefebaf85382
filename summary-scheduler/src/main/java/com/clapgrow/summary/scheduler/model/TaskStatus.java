package com.clapgrow.summary.scheduler.model;

import java.time.LocalDateTime;

/**
 * Read-only snapshot of a scheduled task.
 */
public record TaskStatus(String groupId,
                         String groupName,
                         TaskState state,
                         LocalDateTime nextRun,
                         int retryCount,
                         String lastError,
                         LocalDateTime lastSuccessAt) {
}
