package com.stepwise.core.graph;

import com.stepwise.core.StepwiseException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more TDD chains in the task list are broken. Fatal before any dispatch.
 */
public class DependencyException extends StepwiseException {

    /**
     * A single broken link.
     */
    public record Problem(String taskId, String message) {
        @Override
        public String toString() {
            return taskId + ": " + message;
        }
    }

    private final List<Problem> problems;

    public DependencyException(List<Problem> problems) {
        super(problems.size() + " dependency problem(s): "
                + problems.stream().map(Problem::toString).collect(Collectors.joining("; ")));
        this.problems = List.copyOf(problems);
    }

    public List<Problem> getProblems() {
        return problems;
    }

    public List<String> taskIds() {
        return problems.stream().map(Problem::taskId).distinct().toList();
    }
}
