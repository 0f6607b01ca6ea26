package com.stepwise.core.model;

import java.io.Serializable;

/**
 * What an external worker reports after attempting a task.
 *
 * @param success   whether the worker believes it made the change
 * @param evidence  test-run summary or captured output
 * @param elapsedMs wall-clock time spent
 */
public record WorkerResult(
    boolean success,
    String evidence,
    long elapsedMs
) implements Serializable {

    public static WorkerResult failure(String evidence) {
        return new WorkerResult(false, evidence, 0L);
    }
}
