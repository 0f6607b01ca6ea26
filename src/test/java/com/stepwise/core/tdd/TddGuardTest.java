package com.stepwise.core.tdd;

import com.stepwise.core.metrics.StepwiseMetrics;
import com.stepwise.core.model.DomainTag;
import com.stepwise.core.model.ExecutionRecord;
import com.stepwise.core.model.ExecutionStatus;
import com.stepwise.core.model.FailureKind;
import com.stepwise.core.model.GuardDecision;
import com.stepwise.core.model.Task;
import com.stepwise.core.model.TddPhase;
import com.stepwise.core.model.TestEvidence;
import com.stepwise.core.tracker.StatusTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TddGuardTest {

    private static final Path WORKSPACE = Path.of("/tmp/ws");

    private StatusTracker tracker;
    private TestRunner testRunner;
    private SimpleMeterRegistry registry;
    private TddGuard guard;

    @BeforeEach
    void setUp() {
        tracker = mock(StatusTracker.class);
        testRunner = mock(TestRunner.class);
        registry = new SimpleMeterRegistry();
        guard = new TddGuard(tracker, new TestEvidenceParser(), testRunner, new StepwiseMetrics(registry));
    }

    private static Task task(String id, TddPhase phase, String pred) {
        return new Task(id, "Do " + id, phase, DomainTag.BACKEND, pred, List.of(), 0);
    }

    private void givenStatus(String taskId, ExecutionStatus status) {
        var record = ExecutionRecord.pending(taskId).transition(status);
        when(tracker.queryStatus(taskId)).thenReturn(record);
        when(tracker.status(taskId)).thenReturn(status);
    }

    private static TestEvidence evidence(boolean recognized, boolean passed, FailureKind kind) {
        return new TestEvidence(recognized, passed, 3, passed ? 0 : 1, kind, "");
    }

    @Nested
    @DisplayName("canStart")
    class CanStart {

        @Test
        @DisplayName("FailingTest and unphased tasks may always start")
        void unconstrained() {
            assertTrue(guard.canStart(task("T1", TddPhase.FAILING_TEST, null), WORKSPACE).allowed());
            assertTrue(guard.canStart(task("T2", TddPhase.NONE, null), WORKSPACE).allowed());
            verifyNoInteractions(testRunner);
        }

        @Test
        @DisplayName("MakePass waits for its FailingTest to complete")
        void makePassNeedsCompletedPredecessor() {
            givenStatus("T1", ExecutionStatus.FAILED);
            GuardDecision decision = guard.canStart(task("T2", TddPhase.MAKE_PASS, "T1"), WORKSPACE);
            assertFalse(decision.allowed());
            assertEquals("predecessor T1 is FAILED", decision.reason());

            givenStatus("T1", ExecutionStatus.COMPLETED);
            assertTrue(guard.canStart(task("T2", TddPhase.MAKE_PASS, "T1"), WORKSPACE).allowed());
        }

        @Test
        @DisplayName("Cleanup needs a green suite in its workspace")
        void cleanupRunsSuite() {
            givenStatus("T2", ExecutionStatus.COMPLETED);
            when(testRunner.run(WORKSPACE)).thenReturn("Tests run: 4, Failures: 0, Errors: 0");
            assertTrue(guard.canStart(task("T3", TddPhase.CLEANUP, "T2"), WORKSPACE).allowed());

            when(testRunner.run(WORKSPACE)).thenReturn("Tests run: 4, Failures: 1, Errors: 0");
            assertFalse(guard.canStart(task("T3", TddPhase.CLEANUP, "T2"), WORKSPACE).allowed());
        }

        @Test
        @DisplayName("Cleanup on a broken suite stops the run")
        void cleanupOnBrokenSuite() {
            givenStatus("T2", ExecutionStatus.COMPLETED);
            when(testRunner.run(any())).thenReturn("Could not resolve dependencies\nBUILD FAILURE");
            var e = assertThrows(SuiteBrokenException.class,
                    () -> guard.canStart(task("T3", TddPhase.CLEANUP, "T2"), WORKSPACE));
            assertEquals("T3", e.getTaskId());
        }

        @Test
        @DisplayName("Cleanup without a test command is rejected")
        void cleanupWithoutRunner() {
            var noRunner = new TddGuard(tracker, new TestEvidenceParser(), null, new StepwiseMetrics(registry));
            givenStatus("T2", ExecutionStatus.COMPLETED);
            assertFalse(noRunner.canStart(task("T3", TddPhase.CLEANUP, "T2"), WORKSPACE).allowed());
        }

        @Test
        @DisplayName("Cleanup is not tested while MakePass is unfinished")
        void cleanupSkipsSuiteWhenPredecessorOpen() {
            givenStatus("T2", ExecutionStatus.PENDING);
            assertFalse(guard.canStart(task("T3", TddPhase.CLEANUP, "T2"), WORKSPACE).allowed());
            verifyNoInteractions(testRunner);
        }
    }

    @Nested
    @DisplayName("accept")
    class Accept {

        private final Task failingTest = task("T1", TddPhase.FAILING_TEST, null);

        @Test
        @DisplayName("FailingTest accepted on assertion or missing symbol")
        void failingTestExpectedReasons() {
            assertTrue(guard.accept(failingTest, evidence(true, false, FailureKind.ASSERTION)).allowed());
            assertTrue(guard.accept(failingTest, evidence(true, false, FailureKind.MISSING_SYMBOL)).allowed());
        }

        @Test
        @DisplayName("FailingTest rejected when the new test passes")
        void failingTestPassedUnexpectedly() {
            GuardDecision decision = guard.accept(failingTest, evidence(true, true, FailureKind.NONE));
            assertFalse(decision.allowed());
            assertTrue(decision.reason().contains("passed unexpectedly"));
        }

        @Test
        @DisplayName("FailingTest rejected on setup errors and unrecognized output")
        void failingTestUnrelatedReasons() {
            assertFalse(guard.accept(failingTest, evidence(true, false, FailureKind.SETUP_ERROR)).allowed());
            assertFalse(guard.accept(failingTest, evidence(true, false, FailureKind.UNKNOWN)).allowed());
            assertFalse(guard.accept(failingTest, evidence(false, false, FailureKind.UNKNOWN)).allowed());
        }

        @Test
        @DisplayName("MakePass and Cleanup need a green run")
        void greenPhases() {
            var makePass = task("T2", TddPhase.MAKE_PASS, "T1");
            var cleanup = task("T3", TddPhase.CLEANUP, "T2");
            assertTrue(guard.accept(makePass, evidence(true, true, FailureKind.NONE)).allowed());
            assertFalse(guard.accept(makePass, evidence(true, false, FailureKind.ASSERTION)).allowed());
            assertTrue(guard.accept(cleanup, evidence(true, true, FailureKind.NONE)).allowed());
            assertFalse(guard.accept(cleanup, evidence(false, false, FailureKind.UNKNOWN)).allowed());
        }

        @Test
        @DisplayName("unphased tasks are accepted without evidence")
        void unphased() {
            assertTrue(guard.accept(task("T4", TddPhase.NONE, null), evidence(false, false, FailureKind.UNKNOWN)).allowed());
        }

        @Test
        @DisplayName("verdicts are counted")
        void recordsMetrics() {
            guard.accept(failingTest, evidence(true, true, FailureKind.NONE));
            assertEquals(1.0, registry.get("stepwise.guard.verdicts")
                    .tag("check", "accept").tag("result", "rejected").counter().count());
        }
    }
}
