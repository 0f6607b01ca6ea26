package com.stepwise.core.tdd;

import com.stepwise.core.StepwiseException;

/**
 * The test suite itself cannot run (build or environment failure), so no phase
 * verdict can be trusted. Execution halts before the next group.
 */
public class SuiteBrokenException extends StepwiseException {

    private final String taskId;

    public SuiteBrokenException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
