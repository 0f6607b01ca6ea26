package com.stepwise.workspace;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Gives every task its own isolated copy of the shared tree, so a failed task can
 * be discarded without touching sibling work, and folds completed tasks back into
 * the shared tree at checkpoints.
 */
public interface WorkspaceManager {

    /**
     * Creates a fresh workspace for a task, replacing any leftover from an earlier attempt.
     *
     * @param taskId     the task the workspace is for
     * @param baseTaskId task whose not-yet-checkpointed change the workspace starts from,
     *                   or null to start from the shared tree
     * @return the workspace directory
     */
    Path acquire(String taskId, String baseTaskId);

    /**
     * Commits whatever the worker left in the workspace onto the task's own line of history.
     *
     * @return the commit holding the task's change
     */
    String commitTask(String taskId, String message);

    /**
     * Removes the workspace but keeps the task's committed change for the next checkpoint.
     */
    void release(String taskId);

    /**
     * Throws away the task's workspace and every change it made. Idempotent.
     */
    void discard(String taskId);

    boolean hasTaskChange(String taskId);

    /**
     * Integrates the given tasks' changes, in order, into the shared tree as one commit.
     *
     * @return the checkpoint commit, or empty if the combined change is empty
     * @throws CommitException if the shared tree was modified outside the scheduler or
     *                         the changes conflict; the shared tree is left as it was
     */
    Optional<String> checkpoint(String message, List<String> taskIds);
}
