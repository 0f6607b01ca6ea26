package com.stepwise.core.model;

/**
 * Status of a task within a run.
 */
public enum ExecutionStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    BLOCKED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == BLOCKED;
    }
}
