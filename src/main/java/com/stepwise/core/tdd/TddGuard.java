package com.stepwise.core.tdd;

import com.stepwise.core.metrics.StepwiseMetrics;
import com.stepwise.core.model.ExecutionStatus;
import com.stepwise.core.model.FailureKind;
import com.stepwise.core.model.GuardDecision;
import com.stepwise.core.model.Task;
import com.stepwise.core.model.TestEvidence;
import com.stepwise.core.tracker.StatusTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Enforces the TDD phase rules around a worker.
 * <ul>
 *   <li>FailingTest: may always start; accepted only if the tests fail for an expected
 *       reason (assertion or missing symbol). A test that passes means it tests the wrong thing.</li>
 *   <li>MakePass: may start once its FailingTest is Completed; accepted only on a passing run.</li>
 *   <li>Cleanup: may start once its MakePass is Completed and a fresh test run is green;
 *       accepted only if the run stays green.</li>
 * </ul>
 * Tasks without a phase are not constrained here.
 */
@Service
public class TddGuard {

    private static final Logger log = LoggerFactory.getLogger(TddGuard.class);

    private final StatusTracker tracker;
    private final TestEvidenceParser parser;
    private final TestRunner testRunner;
    private final StepwiseMetrics metrics;

    public TddGuard(StatusTracker tracker, TestEvidenceParser parser,
                    @Autowired(required = false) TestRunner testRunner, StepwiseMetrics metrics) {
        this.tracker = tracker;
        this.parser = parser;
        this.testRunner = testRunner;
        this.metrics = metrics;
    }

    /**
     * Precondition check, made against the tracker and, for Cleanup, a fresh test run
     * in the task's workspace.
     *
     * @throws SuiteBrokenException if the fresh run cannot build or set up the suite
     */
    public GuardDecision canStart(Task task, Path workspace) {
        GuardDecision decision = switch (task.phase()) {
            case NONE, FAILING_TEST -> GuardDecision.allow("no precondition");
            case MAKE_PASS -> predecessorCompleted(task);
            case CLEANUP -> {
                GuardDecision predecessor = predecessorCompleted(task);
                yield predecessor.allowed() ? suiteGreen(task, workspace) : predecessor;
            }
        };
        metrics.recordGuardVerdict("start", decision.allowed());
        if (!decision.allowed()) {
            log.info("{} may not start: {}", task.id(), decision.reason());
        }
        return decision;
    }

    public GuardDecision accept(Task task, TestEvidence evidence) {
        GuardDecision decision = switch (task.phase()) {
            case NONE -> GuardDecision.allow("no postcondition");
            case FAILING_TEST -> failingForExpectedReason(evidence);
            case MAKE_PASS, CLEANUP -> evidence.passed()
                    ? GuardDecision.allow(evidence.summary())
                    : GuardDecision.reject("test run not green: " + evidence.summary());
        };
        metrics.recordGuardVerdict("accept", decision.allowed());
        log.info("{} {} by TDD guard: {}", task.id(), decision.allowed() ? "accepted" : "rejected", decision.reason());
        return decision;
    }

    private GuardDecision predecessorCompleted(Task task) {
        if (!task.hasPredecessor()) {
            return GuardDecision.reject("no predecessor to verify");
        }
        ExecutionStatus status = tracker.status(task.predecessorRef());
        return status == ExecutionStatus.COMPLETED
                ? GuardDecision.allow(task.predecessorRef() + " is COMPLETED")
                : GuardDecision.reject("predecessor " + task.predecessorRef() + " is " + status);
    }

    private GuardDecision suiteGreen(Task task, Path workspace) {
        if (testRunner == null) {
            return GuardDecision.reject("no test command configured; cannot verify the suite is green before cleanup");
        }
        TestEvidence evidence = parser.parse(testRunner.run(workspace));
        if (evidence.failureKind() == FailureKind.SETUP_ERROR) {
            throw new SuiteBrokenException(task.id(), "test suite is broken before " + task.id() + ": " + evidence.summary());
        }
        return evidence.passed()
                ? GuardDecision.allow("suite green: " + evidence.summary())
                : GuardDecision.reject("suite not green before cleanup: " + evidence.summary());
    }

    private GuardDecision failingForExpectedReason(TestEvidence evidence) {
        if (!evidence.recognized()) {
            return GuardDecision.reject("no recognizable test output");
        }
        if (evidence.passed()) {
            return GuardDecision.reject("new test passed unexpectedly; it does not exercise the missing behavior");
        }
        return switch (evidence.failureKind()) {
            case ASSERTION, MISSING_SYMBOL -> GuardDecision.allow("failing as expected: " + evidence.summary());
            default -> GuardDecision.reject("failing for an unrelated reason: " + evidence.summary());
        };
    }
}
