package com.stepwise.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated tasks together with the batches and groups computed from them.
 * Computed once before execution and never mutated.
 */
public record ExecutionPlan(
    List<Task> tasks,
    List<Batch> batches,
    List<Group> groups
) implements Serializable {

    public ExecutionPlan {
        tasks = List.copyOf(tasks);
        batches = List.copyOf(batches);
        groups = List.copyOf(groups);
    }

    public Map<String, Task> taskIndex() {
        var index = new LinkedHashMap<String, Task>();
        for (var t : tasks) {
            index.put(t.id(), t);
        }
        return index;
    }

    public Optional<Task> task(String id) {
        return tasks.stream().filter(t -> t.id().equals(id)).findFirst();
    }

    /**
     * Returns the group a task was scheduled into.
     */
    public Optional<Group> groupOf(String taskId) {
        return groups.stream().filter(g -> g.taskIds().contains(taskId)).findFirst();
    }
}
