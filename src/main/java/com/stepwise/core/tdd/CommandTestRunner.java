package com.stepwise.core.tdd;

import com.stepwise.core.StepwiseException;
import com.stepwise.worker.ShellCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * {@link TestRunner} that runs a configured shell command, e.g. {@code mvn -q test}.
 * A timed-out run is reported as a build failure.
 */
public class CommandTestRunner implements TestRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandTestRunner.class);

    private final String command;
    private final Duration timeout;
    private final ShellCommandRunner shell;

    public CommandTestRunner(String command, Duration timeout, ShellCommandRunner shell) {
        this.command = command;
        this.timeout = timeout;
        this.shell = shell;
    }

    @Override
    public String run(Path workspace) {
        log.info("Running test suite in {}", workspace);
        try {
            var result = shell.run(command, workspace, Map.of(), timeout);
            if (result.timedOut()) {
                return result.output() + "\nBUILD FAILED: test command timed out after " + timeout.toSeconds() + "s";
            }
            log.info("Test suite finished with exit code {} in {}ms", result.exitCode(), result.elapsedMs());
            return result.output();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepwiseException("Interrupted while running tests in " + workspace, e);
        }
    }

    public String getCommand() {
        return command;
    }
}
