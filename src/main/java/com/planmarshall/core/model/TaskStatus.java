package com.planmarshall.core.model;

/**
 * Execution status of a task. {@code DONE} and {@code BLOCKED} are terminal for a single execute pass.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    BLOCKED,
    DONE;

    public boolean isTerminal() {
        return this == DONE || this == BLOCKED;
    }
}
