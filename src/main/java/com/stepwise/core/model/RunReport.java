package com.stepwise.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Final outcome of a run. Every planned task appears in exactly one of the lists.
 *
 * @param runId        identifier of the run
 * @param completed    tasks that ended Completed (including ones completed by an earlier run)
 * @param failed       tasks that ended Failed
 * @param blocked      tasks that ended Blocked
 * @param notRun       tasks never reached because the run aborted
 * @param checkpoints  checkpoints created by this run
 * @param abortReason  why the run stopped early; null if it ran to the end
 * @param durationMs   wall-clock duration of the run
 */
public record RunReport(
    String runId,
    List<String> completed,
    List<String> failed,
    List<String> blocked,
    List<String> notRun,
    List<Checkpoint> checkpoints,
    String abortReason,
    long durationMs
) implements Serializable {

    public static final int EXIT_OK = 0;
    public static final int EXIT_PREFLIGHT_ERROR = 1;
    public static final int EXIT_INCOMPLETE = 2;
    public static final int EXIT_ABORTED = 3;

    public RunReport {
        completed = List.copyOf(completed);
        failed = List.copyOf(failed);
        blocked = List.copyOf(blocked);
        notRun = List.copyOf(notRun);
        checkpoints = List.copyOf(checkpoints);
    }

    public boolean aborted() {
        return abortReason != null;
    }

    public boolean successful() {
        return !aborted() && failed.isEmpty() && blocked.isEmpty() && notRun.isEmpty();
    }

    public int exitCode() {
        if (aborted()) return EXIT_ABORTED;
        return successful() ? EXIT_OK : EXIT_INCOMPLETE;
    }
}
