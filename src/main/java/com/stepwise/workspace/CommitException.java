package com.stepwise.workspace;

import com.stepwise.core.StepwiseException;

/**
 * The shared tree was not in a state a checkpoint could be made on: it had
 * changes nobody scheduled, or task branches conflicted. The run aborts and
 * the tree needs manual attention.
 */
public class CommitException extends StepwiseException {

    public CommitException(String message) {
        super(message);
    }

    public CommitException(String message, Throwable cause) {
        super(message, cause);
    }
}
