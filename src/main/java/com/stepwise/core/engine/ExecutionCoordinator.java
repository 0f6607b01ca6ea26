package com.stepwise.core.engine;

import com.stepwise.config.StepwiseProperties;
import com.stepwise.core.events.EventBus;
import com.stepwise.core.events.SchedulerEvent;
import com.stepwise.core.graph.DependencyGraph;
import com.stepwise.core.logging.MdcContext;
import com.stepwise.core.metrics.StepwiseMetrics;
import com.stepwise.core.model.Batch;
import com.stepwise.core.model.Checkpoint;
import com.stepwise.core.model.ExecutionPlan;
import com.stepwise.core.model.ExecutionRecord;
import com.stepwise.core.model.ExecutionStatus;
import com.stepwise.core.model.GuardDecision;
import com.stepwise.core.model.Group;
import com.stepwise.core.model.RunReport;
import com.stepwise.core.model.Task;
import com.stepwise.core.model.TestEvidence;
import com.stepwise.core.model.WorkerResult;
import com.stepwise.core.rollback.RollbackManager;
import com.stepwise.core.tdd.SuiteBrokenException;
import com.stepwise.core.tdd.TddGuard;
import com.stepwise.core.tdd.TestEvidenceParser;
import com.stepwise.core.tdd.TestRunner;
import com.stepwise.core.tracker.StatusTracker;
import com.stepwise.core.tracker.TrackerInconsistencyException;
import com.stepwise.worker.WorkerDispatcher;
import com.stepwise.workspace.CommitException;
import com.stepwise.workspace.WorkspaceException;
import com.stepwise.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives an {@link ExecutionPlan} group by group.
 *
 * <p>Within a group every batch runs on its own worker and the tasks of a parallel
 * batch run concurrently, each in its own workspace. A task whose predecessor sits in
 * an earlier batch of the same group waits for that predecessor to settle and starts
 * from its change. All batches of a group must settle before exactly one checkpoint
 * folds the group's completed work into the shared tree; only then does the next
 * group start.
 *
 * <p>Per-task failures (worker failure, guard rejection, timeout) roll the task back
 * and block its dependents but leave the rest of the run going. A checkpoint conflict,
 * a tracker disagreement or a broken test suite stops the run before the next group.
 *
 * <p>The tracker is consulted before every dispatch, so re-running a plan skips tasks
 * an earlier run already completed.
 */
@Service
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private static final int MAX_REASON_CHARS = 500;

    private final StatusTracker tracker;
    private final WorkspaceManager workspaceManager;
    private final WorkerDispatcher workerDispatcher;
    private final TddGuard guard;
    private final RollbackManager rollbackManager;
    private final TestEvidenceParser evidenceParser;
    private final TestRunner testRunner;
    private final EventBus eventBus;
    private final StepwiseMetrics metrics;
    private final int maxGroupSize;
    private final Duration taskTimeout;
    private final boolean verifyWithTestRunner;

    @Autowired
    public ExecutionCoordinator(StatusTracker tracker, WorkspaceManager workspaceManager,
                                WorkerDispatcher workerDispatcher, TddGuard guard,
                                RollbackManager rollbackManager, TestEvidenceParser evidenceParser,
                                @Autowired(required = false) TestRunner testRunner,
                                EventBus eventBus, StepwiseMetrics metrics,
                                StepwiseProperties properties) {
        this(tracker, workspaceManager, workerDispatcher, guard, rollbackManager, evidenceParser, testRunner,
                eventBus, metrics, properties.getMaxGroupSize(),
                Duration.ofSeconds(properties.getTaskTimeoutSeconds()), properties.isVerifyWithTestRunner());
    }

    public ExecutionCoordinator(StatusTracker tracker, WorkspaceManager workspaceManager,
                                WorkerDispatcher workerDispatcher, TddGuard guard,
                                RollbackManager rollbackManager, TestEvidenceParser evidenceParser,
                                TestRunner testRunner, EventBus eventBus, StepwiseMetrics metrics,
                                int maxGroupSize, Duration taskTimeout, boolean verifyWithTestRunner) {
        this.tracker = tracker;
        this.workspaceManager = workspaceManager;
        this.workerDispatcher = workerDispatcher;
        this.guard = guard;
        this.rollbackManager = rollbackManager;
        this.evidenceParser = evidenceParser;
        this.testRunner = testRunner;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxGroupSize = maxGroupSize;
        this.taskTimeout = taskTimeout;
        this.verifyWithTestRunner = verifyWithTestRunner;
    }

    public static String newRunId() {
        return "run-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public RunReport run(String runId, ExecutionPlan plan) {
        long start = System.currentTimeMillis();
        MdcContext.setRun(runId);
        log.info("Starting run {}: {} tasks in {} batches, {} groups",
                runId, plan.tasks().size(), plan.batches().size(), plan.groups().size());
        publish("run.started", runId, null, Map.of(
                "tasks", plan.tasks().size(), "groups", plan.groups().size()));

        var graph = new DependencyGraph(plan.tasks());
        var checkpoints = new ArrayList<Checkpoint>();
        String abortReason = null;

        ExecutorService batchPool = Executors.newFixedThreadPool(maxGroupSize, namedThreads("stepwise-batch-"));
        ExecutorService taskPool = Executors.newCachedThreadPool(namedThreads("stepwise-task-"));
        try {
            prepare(runId, plan).ifPresent(checkpoints::add);

            for (Group group : plan.groups()) {
                GroupOutcome outcome = runGroup(runId, group, plan, graph, batchPool, taskPool);
                if (outcome.fatal() != null) {
                    throw outcome.fatal();
                }
                checkpoint(runId, group.index(), group.taskIds()).ifPresent(checkpoints::add);
                if (outcome.suiteBroken() != null) {
                    abortReason = outcome.suiteBroken().getMessage();
                    break;
                }
            }
        } catch (CommitException | TrackerInconsistencyException | WorkspaceException e) {
            abortReason = e.getMessage();
            log.error("Run {} aborted: {}", runId, e.getMessage());
        } finally {
            batchPool.shutdownNow();
            taskPool.shutdownNow();
        }

        RunReport report = report(runId, plan, checkpoints, abortReason, System.currentTimeMillis() - start);
        if (report.aborted()) {
            publish("run.aborted", runId, null, Map.of("reason", abortReason));
            metrics.recordRunResult("aborted");
        } else {
            publish("run.completed", runId, null, Map.of(
                    "completed", report.completed().size(),
                    "failed", report.failed().size(),
                    "blocked", report.blocked().size()));
            metrics.recordRunResult(report.successful() ? "success" : "incomplete");
        }
        log.info("Run {} finished in {}ms: {} completed, {} failed, {} blocked, {} not run",
                runId, report.durationMs(), report.completed().size(), report.failed().size(),
                report.blocked().size(), report.notRun().size());
        MdcContext.clear();
        return report;
    }

    /**
     * Reconciles persisted state with the plan before the first group: stale
     * in-progress work from a crashed run is discarded, failed and blocked tasks get
     * another attempt, and completed work that never reached a checkpoint is folded in.
     */
    private Optional<Checkpoint> prepare(String runId, ExecutionPlan plan) {
        var recovered = new ArrayList<String>();
        for (Task task : plan.tasks()) {
            ExecutionRecord record = tracker.queryStatus(task.id());
            switch (record.status()) {
                case IN_PROGRESS -> {
                    log.warn("{} was left IN_PROGRESS by an interrupted run; discarding its workspace", task.id());
                    workspaceManager.discard(task.id());
                    tracker.markPending(task.id());
                }
                case FAILED, BLOCKED -> {
                    log.info("{} ended {} in an earlier run; scheduling it again", task.id(), record.status());
                    tracker.markPending(task.id());
                }
                case COMPLETED -> {
                    if (!record.checkpointed()) {
                        if (!workspaceManager.hasTaskChange(task.id())) {
                            throw new TrackerInconsistencyException(task.id(),
                                    "recorded COMPLETED but its change is missing and was never checkpointed");
                        }
                        recovered.add(task.id());
                    }
                }
                case PENDING -> {
                    // nothing to reconcile
                }
            }
        }
        if (recovered.isEmpty()) {
            return Optional.empty();
        }
        log.info("Folding in {} tasks completed by an earlier run: {}", recovered.size(), String.join(", ", recovered));
        return checkpoint(runId, 0, recovered);
    }

    private GroupOutcome runGroup(String runId, Group group, ExecutionPlan plan, DependencyGraph graph,
                                  ExecutorService batchPool, ExecutorService taskPool) {
        long start = System.currentTimeMillis();
        MdcContext.setGroup(runId, group.index());
        log.info("Group {}: {} batches, tasks {}", group.index(), group.batches().size(),
                String.join(", ", group.taskIds()));
        publish("group.started", runId, null, Map.of(
                "groupIndex", group.index(), "tasks", group.taskIds()));

        var context = new GroupContext(runId, group.index(), graph, taskPool);
        for (String taskId : group.taskIds()) {
            context.settled.put(taskId, new CompletableFuture<>());
        }

        var batchFutures = new ArrayList<Future<?>>();
        for (Batch batch : group.batches()) {
            batchFutures.add(batchPool.submit(() -> runBatch(batch, context)));
        }

        // Barrier: the group settles completely before anything is committed
        for (Future<?> future : batchFutures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.fatal.compareAndSet(null,
                        new TrackerInconsistencyException("group-" + group.index(), "interrupted while waiting for batches", e));
            } catch (ExecutionException e) {
                log.error("Batch worker of group {} failed", group.index(), e.getCause());
                context.fatal.compareAndSet(null, new TrackerInconsistencyException("group-" + group.index(),
                        "batch worker failed: " + e.getCause().getMessage(), e.getCause()));
            }
        }

        metrics.recordGroupExecution(group.batches().size(), System.currentTimeMillis() - start);
        return new GroupOutcome(context.fatal.get(), context.suiteBroken.get());
    }

    private void runBatch(Batch batch, GroupContext context) {
        if (batch.size() == 1) {
            executeTask(batch.tasks().get(0), context);
            return;
        }
        var futures = batch.tasks().stream()
                .map(task -> CompletableFuture.runAsync(() -> executeTask(task, context), context.taskPool))
                .toList();
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
    }

    private void executeTask(Task task, GroupContext context) {
        MdcContext.setTask(context.runId, context.groupIndex, task.id(), task.phase().name());
        try {
            awaitPredecessor(task, context);
            processTask(task, context);
        } catch (TrackerInconsistencyException e) {
            log.error("Tracker disagreement on {}: {}", task.id(), e.getMessage());
            context.fatal.compareAndSet(null, e);
        } catch (SuiteBrokenException e) {
            log.error("Test suite broken while preparing {}: {}", task.id(), e.getMessage());
            context.suiteBroken.compareAndSet(null, e);
        } finally {
            context.settled.get(task.id()).complete(null);
            MdcContext.clear();
        }
    }

    private void awaitPredecessor(Task task, GroupContext context) {
        if (!task.hasPredecessor()) {
            return;
        }
        CompletableFuture<Void> predecessor = context.settled.get(task.predecessorRef());
        if (predecessor != null) {
            log.debug("{} waiting for {} to settle", task.id(), task.predecessorRef());
            predecessor.join();
        }
    }

    private void processTask(Task task, GroupContext context) {
        String runId = context.runId;
        ExecutionRecord record = tracker.queryStatus(task.id());
        switch (record.status()) {
            case COMPLETED -> {
                log.info("{} already COMPLETED, skipping", task.id());
                publish("task.skipped", runId, task.id(), Map.of("reason", "already completed"));
                return;
            }
            case FAILED, BLOCKED -> {
                log.info("{} already settled as {} in this run", task.id(), record.status());
                return;
            }
            case IN_PROGRESS -> throw new TrackerInconsistencyException(task.id(),
                    "found IN_PROGRESS at dispatch time; another process may be running it");
            case PENDING -> tracker.markPending(task.id());
        }

        if (task.hasPredecessor()) {
            ExecutionStatus predecessorStatus = tracker.status(task.predecessorRef());
            if (predecessorStatus != ExecutionStatus.COMPLETED) {
                rollbackManager.block(runId, task,
                        "predecessor " + task.predecessorRef() + " is " + predecessorStatus, context.graph);
                return;
            }
        }

        Path workspace;
        try {
            workspace = workspaceManager.acquire(task.id(), baseFor(task));
        } catch (WorkspaceException e) {
            rollbackManager.rollback(runId, task, "workspace unavailable: " + e.getMessage(), context.graph);
            return;
        }

        GuardDecision start;
        try {
            start = guard.canStart(task, workspace);
        } catch (SuiteBrokenException e) {
            workspaceManager.discard(task.id());
            rollbackManager.block(runId, task, e.getMessage(), context.graph);
            throw e;
        }
        if (!start.allowed()) {
            workspaceManager.discard(task.id());
            rollbackManager.block(runId, task, start.reason(), context.graph);
            return;
        }

        tracker.markInProgress(task.id());
        publish("task.started", runId, task.id(), Map.of(
                "phase", task.phase().name(), "domain", task.domain().name()));
        long started = System.currentTimeMillis();
        try {
            WorkerResult result = dispatchWithDeadline(task, workspace, context);
            if (!result.success()) {
                fail(task, "worker reported failure: " + abbreviate(result.evidence()), context);
                return;
            }

            String rawEvidence = verifyWithTestRunner && testRunner != null
                    ? testRunner.run(workspace)
                    : result.evidence();
            TestEvidence evidence = evidenceParser.parse(rawEvidence);
            GuardDecision verdict = guard.accept(task, evidence);
            if (!verdict.allowed()) {
                fail(task, "rejected by TDD guard: " + verdict.reason(), context);
                return;
            }

            String commitRef = workspaceManager.commitTask(task.id(), "stepwise: " + task.id() + " " + task.description());
            workspaceManager.release(task.id());
            tracker.markCompleted(task.id(), commitRef, evidence.summary());
            metrics.recordTaskExecution(task.phase().name(), System.currentTimeMillis() - started);
            metrics.recordTaskOutcome("completed");
            publish("task.completed", runId, task.id(), Map.of("commit", commitRef, "evidence", evidence.summary()));
            log.info("{} completed ({})", task.id(), evidence.summary());
        } catch (TimeoutException e) {
            fail(task, "timed out after " + taskTimeout.toSeconds() + "s", context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(task, "interrupted", context);
        } catch (TrackerInconsistencyException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Execution of {} failed", task.id(), e);
            fail(task, "execution error: " + e.getMessage(), context);
        }
    }

    /**
     * A task starts from its predecessor's change while that change is not yet in the shared tree.
     */
    private String baseFor(Task task) {
        if (!task.hasPredecessor()) {
            return null;
        }
        ExecutionRecord predecessor = tracker.queryStatus(task.predecessorRef());
        return predecessor.status() == ExecutionStatus.COMPLETED && !predecessor.checkpointed()
                ? task.predecessorRef()
                : null;
    }

    private WorkerResult dispatchWithDeadline(Task task, Path workspace, GroupContext context)
            throws InterruptedException, TimeoutException {
        Future<WorkerResult> future = context.taskPool.submit(() -> {
            MdcContext.setTask(context.runId, context.groupIndex, task.id(), task.phase().name());
            try {
                return workerDispatcher.dispatch(task, workspace);
            } finally {
                MdcContext.clear();
            }
        });
        try {
            return future.get(taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("worker failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private void fail(Task task, String reason, GroupContext context) {
        rollbackManager.rollback(context.runId, task, reason, context.graph);
    }

    private Optional<Checkpoint> checkpoint(String runId, int groupIndex, List<String> candidateIds) {
        List<String> completed = candidateIds.stream()
                .filter(id -> {
                    ExecutionRecord record = tracker.queryStatus(id);
                    return record.status() == ExecutionStatus.COMPLETED && !record.checkpointed();
                })
                .toList();
        if (completed.isEmpty()) {
            log.info("Group {}: nothing completed, no checkpoint", groupIndex);
            return Optional.empty();
        }

        String message = "stepwise: checkpoint group " + groupIndex + " (" + String.join(", ", completed) + ")";
        Optional<String> commitRef = workspaceManager.checkpoint(message, completed);
        if (commitRef.isEmpty()) {
            tracker.markCheckpointed(completed);
            metrics.recordCheckpoint(false);
            log.info("Group {}: no net changes, no checkpoint created", groupIndex);
            return Optional.empty();
        }

        var checkpoint = new Checkpoint(groupIndex, commitRef.get(), completed, Instant.now());
        tracker.recordCheckpoint(checkpoint);
        metrics.recordCheckpoint(true);
        publish("checkpoint.created", runId, null, Map.of(
                "groupIndex", groupIndex, "commit", checkpoint.commitRef(), "tasks", completed));
        return Optional.of(checkpoint);
    }

    private RunReport report(String runId, ExecutionPlan plan, List<Checkpoint> checkpoints,
                             String abortReason, long durationMs) {
        var completed = new ArrayList<String>();
        var failed = new ArrayList<String>();
        var blocked = new ArrayList<String>();
        var notRun = new ArrayList<String>();
        for (Task task : plan.tasks()) {
            switch (tracker.status(task.id())) {
                case COMPLETED -> completed.add(task.id());
                case FAILED -> failed.add(task.id());
                case BLOCKED -> blocked.add(task.id());
                default -> notRun.add(task.id());
            }
        }
        return new RunReport(runId, completed, failed, blocked, notRun, checkpoints, abortReason, durationMs);
    }

    private void publish(String type, String runId, String taskId, Map<String, Object> payload) {
        eventBus.publish(SchedulerEvent.of(type, runId, taskId, payload));
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        String trimmed = text.strip();
        return trimmed.length() <= MAX_REASON_CHARS
                ? trimmed
                : "..." + trimmed.substring(trimmed.length() - MAX_REASON_CHARS);
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class GroupContext {
        final String runId;
        final int groupIndex;
        final DependencyGraph graph;
        final ExecutorService taskPool;
        final Map<String, CompletableFuture<Void>> settled = new ConcurrentHashMap<>();
        final AtomicReference<TrackerInconsistencyException> fatal = new AtomicReference<>();
        final AtomicReference<SuiteBrokenException> suiteBroken = new AtomicReference<>();

        GroupContext(String runId, int groupIndex, DependencyGraph graph, ExecutorService taskPool) {
            this.runId = runId;
            this.groupIndex = groupIndex;
            this.graph = graph;
            this.taskPool = taskPool;
        }
    }

    private record GroupOutcome(TrackerInconsistencyException fatal, SuiteBrokenException suiteBroken) {}
}
