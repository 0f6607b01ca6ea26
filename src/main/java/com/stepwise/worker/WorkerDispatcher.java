package com.stepwise.worker;

import com.stepwise.core.model.Task;
import com.stepwise.core.model.WorkerResult;

import java.nio.file.Path;

/**
 * External executor that makes a task's change inside the task's workspace.
 * The scheduler never inspects the change itself.
 */
public interface WorkerDispatcher {

    /**
     * Performs the task. Implementations must stop promptly when the calling thread
     * is interrupted, which is how deadlines are enforced.
     */
    WorkerResult dispatch(Task task, Path workspace) throws InterruptedException;
}
