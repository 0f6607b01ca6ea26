package com.stepwise.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Batches that run concurrently between two checkpoints.
 *
 * @param index   1-based position in the plan
 * @param batches batches in plan order
 */
public record Group(int index, List<Batch> batches) implements Serializable {

    public Group {
        batches = List.copyOf(batches);
    }

    public List<Task> tasks() {
        return batches.stream().flatMap(b -> b.tasks().stream()).toList();
    }

    public List<String> taskIds() {
        return tasks().stream().map(Task::id).toList();
    }
}
