package com.stepwise.dispatch.cli;

import com.stepwise.core.engine.PlanningService;
import com.stepwise.core.model.Checkpoint;
import com.stepwise.core.model.ExecutionPlan;
import com.stepwise.core.model.ExecutionRecord;
import com.stepwise.core.model.ExecutionStatus;
import com.stepwise.core.model.RunReport;
import com.stepwise.core.model.Task;
import com.stepwise.core.tracker.StatusTracker;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: stepwise status [tasks.md]
 * <p>
 * Shows the persisted status of every task. With a task list, tasks are shown in
 * list order and tasks never started appear as PENDING.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show persisted task status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Task list to report against")
    private Path taskFile;

    private final StatusTracker tracker;
    private final PlanningService planningService;

    public StatusCommand(StatusTracker tracker, PlanningService planningService) {
        this.tracker = tracker;
        this.planningService = planningService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<ExecutionRecord> records;
        if (taskFile != null) {
            Optional<ExecutionPlan> plan = PlanCommand.planOrReport(planningService, taskFile);
            if (plan.isEmpty()) {
                return RunReport.EXIT_PREFLIGHT_ERROR;
            }
            records = new ArrayList<>();
            for (Task task : plan.get().tasks()) {
                records.add(tracker.queryStatus(task.id()));
            }
        } else {
            records = new ArrayList<>(tracker.snapshot().values());
        }

        if (records.isEmpty()) {
            ConsoleOutput.info("No task has been run yet");
            return RunReport.EXIT_OK;
        }

        System.out.println();
        System.out.printf("  %-8s %-12s %-6s %-10s %s%n", "TASK", "STATUS", "CKPT", "COMMIT", "DETAIL");
        System.out.println("  " + "-".repeat(64));
        for (ExecutionRecord r : records) {
            String detail = r.status() == ExecutionStatus.COMPLETED ? r.evidence() : r.reason();
            System.out.printf("  %-8s %-12s %-6s %-10s %s%n",
                    r.taskId(), r.status(), r.checkpointed() ? "yes" : "-",
                    ConsoleOutput.shortRef(r.commitRef()), truncate(detail, 40));
        }

        List<Checkpoint> checkpoints = tracker.checkpoints();
        if (!checkpoints.isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Checkpoints:");
            for (Checkpoint c : checkpoints) {
                System.out.println("  group " + c.groupIndex() + "  " + ConsoleOutput.shortRef(c.commitRef())
                        + "  " + c.timestamp() + "  " + String.join(", ", c.taskIds()));
            }
        }
        return RunReport.EXIT_OK;
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String oneLine = s.replace('\n', ' ');
        return oneLine.length() <= max ? oneLine : oneLine.substring(0, max - 3) + "...";
    }
}
