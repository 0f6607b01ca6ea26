package com.stepwise.core.tracker;

import com.stepwise.core.model.Checkpoint;
import com.stepwise.core.model.ExecutionRecord;
import com.stepwise.core.model.ExecutionStatus;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Authoritative persisted record of task execution.
 * <p>
 * The coordinator consults the tracker before every dispatch rather than trusting
 * in-process memory, so a restarted run skips work that already completed.
 * Implementations reject transitions that do not follow
 * Pending → InProgress → {Completed | Failed} or Pending → Blocked with a
 * {@link TrackerInconsistencyException}.
 */
public interface StatusTracker {

    /**
     * Returns the record for a task, or a fresh Pending record if the task was never seen.
     */
    ExecutionRecord queryStatus(String taskId);

    default ExecutionStatus status(String taskId) {
        return queryStatus(taskId).status();
    }

    void markPending(String taskId);

    void markInProgress(String taskId);

    void markCompleted(String taskId, String commitRef, String evidence);

    void markFailed(String taskId, String reason);

    void markBlocked(String taskId, String reason);

    /**
     * Flags completed tasks as integrated into the shared tree without a new commit.
     */
    void markCheckpointed(Collection<String> taskIds);

    /**
     * Stores a checkpoint and flags its tasks as integrated.
     */
    void recordCheckpoint(Checkpoint checkpoint);

    List<Checkpoint> checkpoints();

    Map<String, ExecutionRecord> snapshot();
}
