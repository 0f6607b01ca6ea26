package com.stepwise.worker;

import com.stepwise.core.model.Task;
import com.stepwise.core.model.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Dispatches a task to a configured shell command run in the task's workspace.
 * <p>
 * The task is passed through the environment:
 * {@code STEPWISE_TASK_ID}, {@code STEPWISE_TASK_PHASE}, {@code STEPWISE_TASK_DOMAIN},
 * {@code STEPWISE_TASK_DESCRIPTION}. Exit code 0 means success; the captured output
 * is the evidence.
 */
public class CommandWorkerDispatcher implements WorkerDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandWorkerDispatcher.class);

    private final String command;
    private final Duration timeout;
    private final ShellCommandRunner shell;

    public CommandWorkerDispatcher(String command, Duration timeout, ShellCommandRunner shell) {
        this.command = command;
        this.timeout = timeout;
        this.shell = shell;
    }

    @Override
    public WorkerResult dispatch(Task task, Path workspace) throws InterruptedException {
        if (command == null || command.isBlank()) {
            return WorkerResult.failure("stepwise.worker.command is not configured");
        }
        log.info("Dispatching {} ({}) to worker", task.id(), task.phase());
        var result = shell.run(command, workspace, environmentFor(task), timeout);
        if (result.timedOut()) {
            return new WorkerResult(false, "worker timed out after " + timeout.toSeconds() + "s\n" + result.output(),
                    result.elapsedMs());
        }
        log.info("Worker for {} exited with code {} in {}ms", task.id(), result.exitCode(), result.elapsedMs());
        return new WorkerResult(result.exitCode() == 0, result.output(), result.elapsedMs());
    }

    static Map<String, String> environmentFor(Task task) {
        return Map.of(
                "STEPWISE_TASK_ID", task.id(),
                "STEPWISE_TASK_PHASE", task.phase().name(),
                "STEPWISE_TASK_DOMAIN", task.domain().name(),
                "STEPWISE_TASK_DESCRIPTION", task.description());
    }
}
