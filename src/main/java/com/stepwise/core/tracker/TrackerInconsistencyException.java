package com.stepwise.core.tracker;

import com.stepwise.core.StepwiseException;

/**
 * The persisted status of a task disagrees with what the run expected.
 * Continuing would risk running a task twice or skipping it, so the run aborts.
 */
public class TrackerInconsistencyException extends StepwiseException {

    private final String taskId;

    public TrackerInconsistencyException(String taskId, String message) {
        super(taskId + ": " + message);
        this.taskId = taskId;
    }

    public TrackerInconsistencyException(String taskId, String message, Throwable cause) {
        super(taskId + ": " + message, cause);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
