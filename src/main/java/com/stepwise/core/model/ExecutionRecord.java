package com.stepwise.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Persisted execution state of one task.
 *
 * @param taskId        the task this record belongs to
 * @param status        current status
 * @param commitRef     commit on the task branch holding the task's change; null if none
 * @param evidence      free-form test-run summary the task was accepted or rejected on
 * @param reason        why the task failed or was blocked; null otherwise
 * @param checkpointed  whether the task's change has been folded into a group checkpoint
 * @param timestamp     time of the last transition
 */
public record ExecutionRecord(
    String taskId,
    ExecutionStatus status,
    String commitRef,
    String evidence,
    String reason,
    boolean checkpointed,
    Instant timestamp
) implements Serializable {

    public static ExecutionRecord pending(String taskId) {
        return new ExecutionRecord(taskId, ExecutionStatus.PENDING, null, null, null, false, Instant.now());
    }

    public ExecutionRecord transition(ExecutionStatus next) {
        return new ExecutionRecord(taskId, next, commitRef, evidence, reason, checkpointed, Instant.now());
    }

    public ExecutionRecord asCompleted(String commit, String testEvidence) {
        return new ExecutionRecord(taskId, ExecutionStatus.COMPLETED, commit, testEvidence, null, false, Instant.now());
    }

    public ExecutionRecord asFailed(String failureReason) {
        return new ExecutionRecord(taskId, ExecutionStatus.FAILED, null, evidence, failureReason, false, Instant.now());
    }

    public ExecutionRecord asBlocked(String blockReason) {
        return new ExecutionRecord(taskId, ExecutionStatus.BLOCKED, null, null, blockReason, false, Instant.now());
    }

    public ExecutionRecord asCheckpointed() {
        return new ExecutionRecord(taskId, status, commitRef, evidence, reason, true, Instant.now());
    }
}
