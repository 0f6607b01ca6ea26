package com.stepwise.dispatch.cli;

import com.stepwise.config.StepwiseConfig;
import com.stepwise.config.StepwiseProperties;
import com.stepwise.core.engine.ExecutionCoordinator;
import com.stepwise.core.engine.PlanningService;
import com.stepwise.core.engine.RunLock;
import com.stepwise.core.events.EventBus;
import com.stepwise.core.model.ExecutionPlan;
import com.stepwise.core.model.RunReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: stepwise run [tasks.md]
 * <p>
 * Plans the task list and executes it. Exit codes: 0 all tasks completed,
 * 1 the list could not be planned, 2 some task failed or was blocked,
 * 3 the run was aborted.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Plan and execute a task list")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", defaultValue = "tasks.md", description = "Task list (default: ${DEFAULT-VALUE})")
    private Path taskFile;

    private final PlanningService planningService;
    private final ExecutionCoordinator coordinator;
    private final EventBus eventBus;
    private final StepwiseProperties properties;

    public RunCommand(PlanningService planningService, ExecutionCoordinator coordinator,
                      EventBus eventBus, StepwiseProperties properties) {
        this.planningService = planningService;
        this.coordinator = coordinator;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Optional<ExecutionPlan> plan = PlanCommand.planOrReport(planningService, taskFile);
        if (plan.isEmpty()) {
            return RunReport.EXIT_PREFLIGHT_ERROR;
        }
        if (properties.getWorkerCommand() == null || properties.getWorkerCommand().isBlank()) {
            ConsoleOutput.error("No worker configured; set stepwise.worker.command");
            return RunReport.EXIT_PREFLIGHT_ERROR;
        }
        ConsoleOutput.plan(plan.get());

        Path stateDir = StepwiseConfig.stateDir(properties);
        try (RunLock lock = RunLock.acquire(stateDir)) {
            String runId = ExecutionCoordinator.newRunId();
            var subscription = eventBus.subscribe(runId, ConsoleOutput::event);
            RunReport report;
            try {
                report = coordinator.run(runId, plan.get());
            } finally {
                subscription.unsubscribe();
            }
            ConsoleOutput.report(report);
            return report.exitCode();
        } catch (RunLock.LockUnavailableException e) {
            ConsoleOutput.error(e.getMessage());
            return RunReport.EXIT_PREFLIGHT_ERROR;
        }
    }
}
