package com.stepwise.core.scheduler;

import com.stepwise.config.StepwiseProperties;
import com.stepwise.core.model.Batch;
import com.stepwise.core.model.ExecutionPlan;
import com.stepwise.core.model.Group;
import com.stepwise.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Packs validated tasks into batches and batches into groups in a single linear pass.
 *
 * <p>Input order is never changed. A phase-bound task closes the open accumulator and
 * gets a batch of its own, so a MakePass task always lands in a later batch than its
 * FailingTest. Unphased tasks accumulate while they share a domain, the batch has
 * room, and they do not depend on a task already in the accumulator.
 */
@Service
public class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    public static final int DEFAULT_MAX_BATCH_SIZE = 4;
    public static final int DEFAULT_MAX_GROUP_SIZE = 3;

    private final int maxBatchSize;
    private final int maxGroupSize;

    @Autowired
    public BatchScheduler(StepwiseProperties properties) {
        this(properties.getMaxBatchSize(), properties.getMaxGroupSize());
    }

    public BatchScheduler(int maxBatchSize, int maxGroupSize) {
        if (maxBatchSize < 1 || maxGroupSize < 1) {
            throw new IllegalArgumentException(
                    "Batch and group sizes must be positive (batch=%d, group=%d)".formatted(maxBatchSize, maxGroupSize));
        }
        this.maxBatchSize = maxBatchSize;
        this.maxGroupSize = maxGroupSize;
    }

    public ExecutionPlan plan(List<Task> tasks) {
        var batches = toBatches(tasks);
        var groups = toGroups(batches);
        log.info("Planned {} tasks into {} batches and {} groups (maxBatch={}, maxGroup={})",
                tasks.size(), batches.size(), groups.size(), maxBatchSize, maxGroupSize);
        return new ExecutionPlan(tasks, batches, groups);
    }

    public List<Batch> toBatches(List<Task> tasks) {
        var batches = new ArrayList<Batch>();
        var accumulator = new ArrayList<Task>();
        Set<String> accumulatedIds = new HashSet<>();

        for (var task : tasks) {
            if (task.isPhaseBound()) {
                flush(accumulator, accumulatedIds, batches);
                batches.add(Batch.sequential(task));
                log.debug("  {} [{}] -> own batch", task.id(), task.phase());
                continue;
            }

            boolean fits = accumulator.isEmpty()
                    || (accumulator.get(0).domain() == task.domain()
                        && accumulator.size() < maxBatchSize
                        && !accumulatedIds.contains(task.predecessorRef()));
            if (!fits) {
                flush(accumulator, accumulatedIds, batches);
            }
            accumulator.add(task);
            accumulatedIds.add(task.id());
        }
        flush(accumulator, accumulatedIds, batches);
        return batches;
    }

    public List<Group> toGroups(List<Batch> batches) {
        var groups = new ArrayList<Group>();
        for (int start = 0; start < batches.size(); start += maxGroupSize) {
            int end = Math.min(start + maxGroupSize, batches.size());
            groups.add(new Group(groups.size() + 1, batches.subList(start, end)));
        }
        return groups;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public int getMaxGroupSize() {
        return maxGroupSize;
    }

    private void flush(List<Task> accumulator, Set<String> accumulatedIds, List<Batch> batches) {
        if (accumulator.isEmpty()) {
            return;
        }
        var batch = Batch.of(accumulator);
        batches.add(batch);
        log.debug("  batch {} [{}] {}", batches.size(), batch.mode(), batch.taskIds());
        accumulator.clear();
        accumulatedIds.clear();
    }
}
