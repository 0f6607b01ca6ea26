package com.stepwise.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A unit of work dispatched to one worker.
 * <p>
 * A batch holding a phase-bound task holds exactly that task and is
 * {@link BatchMode#SEQUENTIAL}. A {@link BatchMode#PARALLEL} batch holds only
 * {@link TddPhase#NONE} tasks sharing one {@link DomainTag}.
 */
public record Batch(List<Task> tasks, BatchMode mode) implements Serializable {

    public Batch {
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("Batch must contain at least one task");
        }
        tasks = List.copyOf(tasks);
        if (tasks.stream().anyMatch(Task::isPhaseBound) && tasks.size() != 1) {
            throw new IllegalArgumentException("Phase-bound task must be alone in its batch: " + ids(tasks));
        }
        if (mode == BatchMode.PARALLEL) {
            if (tasks.stream().anyMatch(Task::isPhaseBound)) {
                throw new IllegalArgumentException("Parallel batch cannot hold a phase-bound task: " + ids(tasks));
            }
            if (tasks.stream().map(Task::domain).distinct().count() > 1) {
                throw new IllegalArgumentException("Parallel batch must share one domain: " + ids(tasks));
            }
        }
    }

    public static Batch sequential(Task task) {
        return new Batch(List.of(task), BatchMode.SEQUENTIAL);
    }

    /**
     * Builds a batch from an accumulator of unphased tasks. A single task is still
     * dispatched alone, so it is recorded as sequential.
     */
    public static Batch of(List<Task> tasks) {
        return new Batch(tasks, tasks.size() > 1 ? BatchMode.PARALLEL : BatchMode.SEQUENTIAL);
    }

    public List<String> taskIds() {
        return ids(tasks);
    }

    public int size() {
        return tasks.size();
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }
}
