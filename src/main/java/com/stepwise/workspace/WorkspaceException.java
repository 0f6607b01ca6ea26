package com.stepwise.workspace;

import com.stepwise.core.StepwiseException;

/**
 * A per-task workspace could not be created, committed or removed.
 * Scoped to one task; the run continues.
 */
public class WorkspaceException extends StepwiseException {

    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
