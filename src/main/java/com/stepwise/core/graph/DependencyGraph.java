package com.stepwise.core.graph;

import com.stepwise.core.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only dependent view over resolved tasks, used for Blocked propagation.
 * Edges always point from an earlier task to a later one.
 */
public class DependencyGraph {

    private final Map<String, List<String>> dependents = new HashMap<>();
    private final List<String> order = new ArrayList<>();

    public DependencyGraph(List<Task> resolvedTasks) {
        for (var task : resolvedTasks) {
            order.add(task.id());
            if (task.hasPredecessor()) {
                dependents.computeIfAbsent(task.predecessorRef(), k -> new ArrayList<>()).add(task.id());
            }
        }
    }

    public List<String> directDependents(String taskId) {
        return dependents.getOrDefault(taskId, List.of());
    }

    /**
     * All tasks that depend on the given one directly or through other tasks,
     * in task-list order.
     */
    public List<String> transitiveDependents(String taskId) {
        Set<String> found = new LinkedHashSet<>();
        var queue = new ArrayDeque<>(directDependents(taskId));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (found.add(next)) {
                queue.addAll(directDependents(next));
            }
        }
        return order.stream().filter(found::contains).toList();
    }
}
