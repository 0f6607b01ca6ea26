package com.stepwise.worker;

import com.stepwise.core.StepwiseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs a shell command in a directory, capturing combined stdout and stderr.
 * <p>
 * Output goes through a temp file so a chatty process never blocks on a full pipe.
 * Interrupting the calling thread kills the process.
 */
public class ShellCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ShellCommandRunner.class);

    static final int MAX_OUTPUT_CHARS = 16_000;

    public record CommandResult(int exitCode, String output, boolean timedOut, long elapsedMs) {

        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }

    public CommandResult run(String command, Path workDir, Map<String, String> environment, Duration timeout)
            throws InterruptedException {
        long start = System.currentTimeMillis();
        Path outputFile = null;
        Process process = null;
        try {
            outputFile = Files.createTempFile("stepwise-cmd-", ".log");
            var builder = new ProcessBuilder(List.of("sh", "-c", command))
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile());
            builder.environment().putAll(environment);

            log.debug("Running in {}: {}", workDir, command);
            process = builder.start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Command timed out after {}s: {}", timeout.toSeconds(), command);
            }
            int exitCode = finished ? process.exitValue() : -1;
            // malformed bytes are replaced, not fatal
            String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
            return new CommandResult(exitCode, tail(output),
                    !finished, System.currentTimeMillis() - start);
        } catch (IOException e) {
            throw new StepwiseException("Failed to run command: " + command, e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            if (outputFile != null) {
                try {
                    Files.deleteIfExists(outputFile);
                } catch (IOException e) {
                    log.debug("Could not delete {}", outputFile, e);
                }
            }
        }
    }

    /**
     * Keeps the end of the output, where test summaries are printed.
     */
    static String tail(String output) {
        if (output.length() <= MAX_OUTPUT_CHARS) {
            return output;
        }
        return "...\n" + output.substring(output.length() - MAX_OUTPUT_CHARS);
    }
}
