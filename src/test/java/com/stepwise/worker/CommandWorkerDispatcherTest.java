package com.stepwise.worker;

import com.stepwise.core.model.DomainTag;
import com.stepwise.core.model.Task;
import com.stepwise.core.model.TddPhase;
import com.stepwise.core.model.WorkerResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CommandWorkerDispatcherTest {

    private static final Path WORKSPACE = Path.of("/tmp/ws");

    private final Task task = new Task("T2", "Implement discount service", TddPhase.MAKE_PASS,
            DomainTag.BACKEND, "T1", List.of(), 2);

    @Test
    void passesTaskThroughEnvironment() throws Exception {
        var shell = mock(ShellCommandRunner.class);
        when(shell.run(eq("./worker.sh"), eq(WORKSPACE), any(), any()))
                .thenReturn(new ShellCommandRunner.CommandResult(0, "Tests run: 3, Failures: 0", false, 40));
        var dispatcher = new CommandWorkerDispatcher("./worker.sh", Duration.ofSeconds(30), shell);

        WorkerResult result = dispatcher.dispatch(task, WORKSPACE);

        assertTrue(result.success());
        assertEquals("Tests run: 3, Failures: 0", result.evidence());
        verify(shell).run("./worker.sh", WORKSPACE, Map.of(
                "STEPWISE_TASK_ID", "T2",
                "STEPWISE_TASK_PHASE", "MAKE_PASS",
                "STEPWISE_TASK_DOMAIN", "BACKEND",
                "STEPWISE_TASK_DESCRIPTION", "Implement discount service"), Duration.ofSeconds(30));
    }

    @Test
    void nonZeroExitIsFailure() throws Exception {
        var shell = mock(ShellCommandRunner.class);
        when(shell.run(any(), any(), any(), any()))
                .thenReturn(new ShellCommandRunner.CommandResult(2, "crashed", false, 10));

        assertFalse(new CommandWorkerDispatcher("w", Duration.ofSeconds(5), shell).dispatch(task, WORKSPACE).success());
    }

    @Test
    void timeoutIsFailure() throws Exception {
        var shell = mock(ShellCommandRunner.class);
        when(shell.run(any(), any(), any(), any()))
                .thenReturn(new ShellCommandRunner.CommandResult(-1, "partial", true, 5000));

        WorkerResult result = new CommandWorkerDispatcher("w", Duration.ofSeconds(5), shell).dispatch(task, WORKSPACE);

        assertFalse(result.success());
        assertTrue(result.evidence().startsWith("worker timed out after 5s"));
    }

    @Test
    void missingCommandFailsWithoutRunningAnything() throws Exception {
        var shell = mock(ShellCommandRunner.class);

        WorkerResult result = new CommandWorkerDispatcher(" ", Duration.ofSeconds(5), shell).dispatch(task, WORKSPACE);

        assertFalse(result.success());
        verifyNoInteractions(shell);
    }
}
