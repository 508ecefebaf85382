package com.clapgrow.summary.scheduler.model;

/**
 * Lifecycle of a scheduled delivery task.
 *
 * IDLE -> RUNNING -> IDLE (success or fallback to the regular slot)
 *                 -> RETRYING -> RUNNING ...
 */
public enum TaskState {
    IDLE,
    RUNNING,
    RETRYING
}
