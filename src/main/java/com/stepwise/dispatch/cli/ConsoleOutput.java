package com.stepwise.dispatch.cli;

import com.stepwise.core.events.SchedulerEvent;
import com.stepwise.core.model.Batch;
import com.stepwise.core.model.BatchMode;
import com.stepwise.core.model.Checkpoint;
import com.stepwise.core.model.ExecutionPlan;
import com.stepwise.core.model.Group;
import com.stepwise.core.model.RunReport;
import com.stepwise.core.model.Task;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for Stepwise CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STEPWISE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [STEPWISE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void plan(ExecutionPlan plan) {
        info(plan.tasks().size() + " tasks, " + plan.batches().size() + " batches, "
                + plan.groups().size() + " groups");
        for (Group group : plan.groups()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|bold,fg(yellow) [GROUP " + group.index() + "]|@"));
            for (Batch batch : group.batches()) {
                String mode = batch.mode() == BatchMode.PARALLEL ? "@|fg(blue) parallel  |@" : "@|fg(magenta) sequential|@";
                System.out.println(CommandLine.Help.Ansi.AUTO.string("  " + mode + " " + describe(batch.tasks())));
            }
        }
    }

    public static void event(SchedulerEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.started" -> "@|fg(cyan) [RUN]|@";
            case "group.started" -> "@|bold,fg(yellow) [GROUP]|@";
            case "task.started" -> "@|fg(blue) [TASK]|@";
            case "task.completed" -> "@|fg(green) [DONE]|@";
            case "task.failed" -> "@|fg(red) [FAILED]|@";
            case "task.blocked" -> "@|fg(yellow) [BLOCKED]|@";
            case "task.skipped" -> "@|fg(white) [SKIP]|@";
            case "checkpoint.created" -> "@|fg(green),bold [CHECKPOINT]|@";
            case "run.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "run.aborted" -> "@|fg(red),bold [ABORTED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.taskId() != null ? event.taskId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + event.payload()));
    }

    public static void report(RunReport report) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run " + report.runId() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) Completed (" + report.completed().size() + ")|@ " + String.join(", ", report.completed())));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) Failed (" + report.failed().size() + ")|@ " + String.join(", ", report.failed())));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) Blocked (" + report.blocked().size() + ")|@ " + String.join(", ", report.blocked())));
        if (!report.notRun().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(white) Not run (" + report.notRun().size() + ")|@ " + String.join(", ", report.notRun())));
        }
        for (Checkpoint checkpoint : report.checkpoints()) {
            System.out.println("  Checkpoint group " + checkpoint.groupIndex() + ": "
                    + shortRef(checkpoint.commitRef()) + " " + String.join(", ", checkpoint.taskIds()));
        }
        System.out.println("  Duration: " + formatDuration(report.durationMs()));
        if (report.aborted()) {
            error("Run aborted: " + report.abortReason());
        } else if (report.successful()) {
            success("All tasks completed");
        } else {
            warn("Some tasks did not complete; see `stepwise failures`");
        }
    }

    static String describe(List<Task> tasks) {
        var sb = new StringBuilder();
        for (Task task : tasks) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(task.id());
            if (task.isPhaseBound()) sb.append(' ').append(task.phase());
            sb.append(" (").append(task.domain()).append(')');
            if (task.hasPredecessor()) sb.append(" after ").append(task.predecessorRef());
        }
        return sb.toString();
    }

    static String shortRef(String ref) {
        if (ref == null) return "-";
        return ref.length() > 10 ? ref.substring(0, 10) : ref;
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
