package com.stepwise.dispatch.cli;

import com.stepwise.core.engine.PlanningService;
import com.stepwise.core.graph.DependencyException;
import com.stepwise.core.model.ExecutionPlan;
import com.stepwise.core.model.RunReport;
import com.stepwise.core.parser.ParseException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: stepwise plan [tasks.md]
 * <p>
 * Shows the batches and groups a run would execute, without executing anything.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Show the execution plan for a task list")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", defaultValue = "tasks.md", description = "Task list (default: ${DEFAULT-VALUE})")
    private Path taskFile;

    private final PlanningService planningService;

    public PlanCommand(PlanningService planningService) {
        this.planningService = planningService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Optional<ExecutionPlan> plan = planOrReport(planningService, taskFile);
        if (plan.isEmpty()) {
            return RunReport.EXIT_PREFLIGHT_ERROR;
        }
        ConsoleOutput.plan(plan.get());
        return RunReport.EXIT_OK;
    }

    /**
     * Plans the task list, printing pre-flight errors instead of throwing.
     */
    static Optional<ExecutionPlan> planOrReport(PlanningService planningService, Path taskFile) {
        try {
            return Optional.of(planningService.plan(taskFile));
        } catch (ParseException e) {
            ConsoleOutput.error("Cannot parse " + taskFile + ": " + e.getMessage());
        } catch (DependencyException e) {
            ConsoleOutput.error("Broken TDD chains in " + taskFile + ":");
            for (var problem : e.getProblems()) {
                ConsoleOutput.error("  " + problem);
            }
        } catch (UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
        }
        return Optional.empty();
    }
}
