package com.stepwise.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for scheduling and execution.
 */
@Service
public class StepwiseMetrics {

    private final MeterRegistry registry;

    public StepwiseMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String phase, long ms) {
        Timer.builder("stepwise.task.duration")
                .tag("phase", phase)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskOutcome(String status) {
        Counter.builder("stepwise.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * @param check "start" or "accept"
     */
    public void recordGuardVerdict(String check, boolean allowed) {
        Counter.builder("stepwise.guard.verdicts")
                .description("TDD guard precondition and postcondition outcomes")
                .tag("check", check)
                .tag("result", allowed ? "allowed" : "rejected")
                .register(registry)
                .increment();
    }

    public void recordRollback(String phase) {
        Counter.builder("stepwise.rollbacks.total")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordCheckpoint(boolean created) {
        Counter.builder("stepwise.checkpoints")
                .tag("result", created ? "created" : "no_changes")
                .register(registry)
                .increment();
    }

    public void recordGroupExecution(int batchCount, long ms) {
        DistributionSummary.builder("stepwise.group.batch_count")
                .description("Number of batches per group")
                .register(registry)
                .record(batchCount);
        Timer.builder("stepwise.group.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRunResult(String outcome) {
        Counter.builder("stepwise.runs.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
