package com.stepwise.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Pattern PROPERTY_ARG = Pattern.compile("--(stepwise|spring|logging|management)\\.[\\w.\\-\\[\\]]+=.*");

    private final StepwiseCommand stepwiseCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(StepwiseCommand stepwiseCommand, IFactory factory) {
        this.stepwiseCommand = stepwiseCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(stepwiseCommand, factory).execute(withoutPropertyArgs(args));
    }

    /**
     * Spring Boot already applied {@code --stepwise.x=y} style arguments as properties;
     * picocli would reject them as unknown options.
     */
    static String[] withoutPropertyArgs(String... args) {
        return Arrays.stream(args)
                .filter(arg -> !PROPERTY_ARG.matcher(arg).matches())
                .toArray(String[]::new);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
