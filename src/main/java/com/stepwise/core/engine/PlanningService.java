package com.stepwise.core.engine;

import com.stepwise.core.graph.DependencyResolver;
import com.stepwise.core.model.ExecutionPlan;
import com.stepwise.core.model.Task;
import com.stepwise.core.parser.TaskParser;
import com.stepwise.core.scheduler.BatchScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Pre-flight pipeline: parse, resolve phase chains, then pack into batches and groups.
 * Any error surfaces before a single task is dispatched.
 */
@Service
public class PlanningService {

    private static final Logger log = LoggerFactory.getLogger(PlanningService.class);

    private final TaskParser parser;
    private final DependencyResolver resolver;
    private final BatchScheduler scheduler;

    public PlanningService(TaskParser parser, DependencyResolver resolver, BatchScheduler scheduler) {
        this.parser = parser;
        this.resolver = resolver;
        this.scheduler = scheduler;
    }

    public ExecutionPlan plan(Path taskFile) {
        log.info("Planning from {}", taskFile);
        return plan(parser.parse(taskFile));
    }

    public ExecutionPlan plan(List<Task> parsed) {
        List<Task> resolved = resolver.resolve(parsed);
        ExecutionPlan plan = scheduler.plan(resolved);
        log.info("Planned {} tasks into {} batches and {} groups",
                plan.tasks().size(), plan.batches().size(), plan.groups().size());
        return plan;
    }
}
