package com.stepwise.core.rollback;

import com.stepwise.core.events.EventBus;
import com.stepwise.core.events.SchedulerEvent;
import com.stepwise.core.graph.DependencyGraph;
import com.stepwise.core.metrics.StepwiseMetrics;
import com.stepwise.core.model.ExecutionStatus;
import com.stepwise.core.model.FailureEntry;
import com.stepwise.core.model.Task;
import com.stepwise.core.tracker.StatusTracker;
import com.stepwise.workspace.WorkspaceException;
import com.stepwise.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Undoes a failed task and keeps its failure from spreading.
 * <p>
 * A rollback discards only the failed task's workspace, so siblings running in the
 * same batch or group keep their work. Every task depending on the failed one,
 * directly or transitively, is marked Blocked so it is never dispatched.
 */
@Service
public class RollbackManager {

    private static final Logger log = LoggerFactory.getLogger(RollbackManager.class);

    private final WorkspaceManager workspaceManager;
    private final FailureLedger ledger;
    private final StatusTracker tracker;
    private final EventBus eventBus;
    private final StepwiseMetrics metrics;

    public RollbackManager(WorkspaceManager workspaceManager, FailureLedger ledger, StatusTracker tracker,
                           EventBus eventBus, StepwiseMetrics metrics) {
        this.workspaceManager = workspaceManager;
        this.ledger = ledger;
        this.tracker = tracker;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Discards the task's changes, records the failure and marks the task Failed.
     *
     * @return the dependents that were blocked as a consequence
     */
    public List<String> rollback(String runId, Task task, String reason, DependencyGraph graph) {
        log.warn("Rolling back {}: {}", task.id(), reason);

        String ledgerReason = reason;
        try {
            workspaceManager.discard(task.id());
        } catch (WorkspaceException e) {
            log.error("Failed to discard workspace of {}", task.id(), e);
            ledgerReason = reason + " (workspace discard failed: " + e.getMessage() + ")";
        }

        ledger.append(new FailureEntry(task.id(), ledgerReason, Instant.now()));
        tracker.markFailed(task.id(), ledgerReason);
        metrics.recordRollback(task.phase().name());
        metrics.recordTaskOutcome("failed");
        eventBus.publish(SchedulerEvent.of("task.failed", runId, task.id(), Map.of("reason", ledgerReason)));

        return blockDependents(runId, task.id(), graph);
    }

    /**
     * Marks a task Blocked without dispatching it, then blocks its dependents.
     *
     * @return the dependents that were blocked as a consequence
     */
    public List<String> block(String runId, Task task, String reason, DependencyGraph graph) {
        markBlocked(runId, task.id(), reason);
        return blockDependents(runId, task.id(), graph);
    }

    /**
     * Blocks every still-pending task that depends on {@code taskId}.
     * Tasks already settled in this or an earlier run keep their status.
     */
    public List<String> blockDependents(String runId, String taskId, DependencyGraph graph) {
        var blocked = new ArrayList<String>();
        for (String dependent : graph.transitiveDependents(taskId)) {
            if (tracker.status(dependent) == ExecutionStatus.PENDING) {
                markBlocked(runId, dependent, "depends on " + taskId + " which did not complete");
                blocked.add(dependent);
            }
        }
        if (!blocked.isEmpty()) {
            log.info("Blocked {} dependents of {}: {}", blocked.size(), taskId, String.join(", ", blocked));
        }
        return blocked;
    }

    private void markBlocked(String runId, String taskId, String reason) {
        tracker.markBlocked(taskId, reason);
        metrics.recordTaskOutcome("blocked");
        eventBus.publish(SchedulerEvent.of("task.blocked", runId, taskId, Map.of("reason", reason)));
    }
}
