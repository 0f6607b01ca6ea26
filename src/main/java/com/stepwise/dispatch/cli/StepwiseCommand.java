package com.stepwise.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Stepwise.
 * Routes to subcommands: run, plan, status, failures.
 */
@Command(
        name = "stepwise",
        mixinStandardHelpOptions = true,
        version = "Stepwise 0.1.0",
        description = "Dependency-aware task batch scheduler with TDD phase enforcement",
        subcommands = {
                RunCommand.class,
                PlanCommand.class,
                StatusCommand.class,
                FailuresCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class StepwiseCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
