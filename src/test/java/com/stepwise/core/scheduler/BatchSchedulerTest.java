package com.stepwise.core.scheduler;

import com.stepwise.core.model.Batch;
import com.stepwise.core.model.BatchMode;
import com.stepwise.core.model.DomainTag;
import com.stepwise.core.model.ExecutionPlan;
import com.stepwise.core.model.Group;
import com.stepwise.core.model.Task;
import com.stepwise.core.model.TddPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BatchSchedulerTest {

    private BatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new BatchScheduler(4, 3);
    }

    private static Task task(String id, TddPhase phase, DomainTag domain, String pred) {
        return new Task(id, "Do " + id, phase, domain, pred, List.of(), 0);
    }

    private static Task none(String id, DomainTag domain) {
        return task(id, TddPhase.NONE, domain, null);
    }

    private static List<List<String>> batchIds(List<Batch> batches) {
        return batches.stream().map(Batch::taskIds).toList();
    }

    @Test
    @DisplayName("FailingTest, MakePass, 2x Backend, Frontend -> [T1],[T2],[T3,T4],[T5] in groups of 3")
    void referenceScenario() {
        var tasks = List.of(
                task("T1", TddPhase.FAILING_TEST, DomainTag.TEST, null),
                task("T2", TddPhase.MAKE_PASS, DomainTag.BACKEND, "T1"),
                none("T3", DomainTag.BACKEND),
                none("T4", DomainTag.BACKEND),
                none("T5", DomainTag.FRONTEND));

        ExecutionPlan plan = scheduler.plan(tasks);

        assertEquals(List.of(List.of("T1"), List.of("T2"), List.of("T3", "T4"), List.of("T5")),
                batchIds(plan.batches()));
        assertEquals(BatchMode.PARALLEL, plan.batches().get(2).mode());
        assertEquals(BatchMode.SEQUENTIAL, plan.batches().get(0).mode());

        assertEquals(2, plan.groups().size());
        assertEquals(List.of(List.of("T1"), List.of("T2"), List.of("T3", "T4")),
                batchIds(plan.groups().get(0).batches()));
        assertEquals(List.of(List.of("T5")), batchIds(plan.groups().get(1).batches()));
        assertEquals(1, plan.groups().get(0).index());
        assertEquals(2, plan.groups().get(1).index());
    }

    @Nested
    @DisplayName("Batching")
    class Batching {

        @Test
        @DisplayName("same-domain run is split at the batch size limit")
        void splitsAtMaxBatchSize() {
            var tasks = new ArrayList<Task>();
            for (int i = 1; i <= 6; i++) {
                tasks.add(none("T" + i, DomainTag.BACKEND));
            }
            assertEquals(List.of(List.of("T1", "T2", "T3", "T4"), List.of("T5", "T6")),
                    batchIds(scheduler.toBatches(tasks)));
        }

        @Test
        @DisplayName("domain change flushes the accumulator")
        void domainChangeFlushes() {
            var tasks = List.of(none("T1", DomainTag.BACKEND), none("T2", DomainTag.DATABASE),
                    none("T3", DomainTag.BACKEND));
            assertEquals(List.of(List.of("T1"), List.of("T2"), List.of("T3")),
                    batchIds(scheduler.toBatches(tasks)));
        }

        @Test
        @DisplayName("phase-bound task flushes and stands alone")
        void phaseBoundFlushes() {
            var tasks = List.of(none("T1", DomainTag.BACKEND), none("T2", DomainTag.BACKEND),
                    task("T3", TddPhase.FAILING_TEST, DomainTag.BACKEND, null),
                    none("T4", DomainTag.BACKEND));
            assertEquals(List.of(List.of("T1", "T2"), List.of("T3"), List.of("T4")),
                    batchIds(scheduler.toBatches(tasks)));
        }

        @Test
        @DisplayName("a task never shares a batch with its predecessor")
        void dependentStartsNewBatch() {
            var tasks = List.of(none("T1", DomainTag.BACKEND),
                    task("T2", TddPhase.NONE, DomainTag.BACKEND, "T1"),
                    none("T3", DomainTag.BACKEND));
            assertEquals(List.of(List.of("T1"), List.of("T2", "T3")), batchIds(scheduler.toBatches(tasks)));
        }

        @Test
        @DisplayName("empty input -> empty plan")
        void emptyInput() {
            ExecutionPlan plan = scheduler.plan(List.of());
            assertTrue(plan.batches().isEmpty());
            assertTrue(plan.groups().isEmpty());
        }

        @Test
        @DisplayName("limits must be positive")
        void rejectsNonPositiveLimits() {
            assertThrows(IllegalArgumentException.class, () -> new BatchScheduler(0, 3));
            assertThrows(IllegalArgumentException.class, () -> new BatchScheduler(4, 0));
        }
    }

    @Nested
    @DisplayName("Invariants over generated task lists")
    class Invariants {

        private List<Task> randomTasks(Random random, int count) {
            var phases = TddPhase.values();
            var domains = DomainTag.values();
            var tasks = new ArrayList<Task>();
            for (int i = 1; i <= count; i++) {
                TddPhase phase = random.nextInt(3) == 0 ? phases[random.nextInt(phases.length)] : TddPhase.NONE;
                tasks.add(task("T" + i, phase, domains[random.nextInt(domains.length)], null));
            }
            return tasks;
        }

        @Test
        @DisplayName("order preserved, limits respected, phase-bound tasks alone, parallel batches homogeneous")
        void invariantsHold() {
            var random = new Random(42);
            for (int round = 0; round < 200; round++) {
                var tasks = randomTasks(random, 1 + random.nextInt(30));
                var plan = scheduler.plan(tasks);

                var flattened = plan.groups().stream()
                        .flatMap(g -> g.batches().stream())
                        .flatMap(b -> b.tasks().stream())
                        .map(Task::id)
                        .toList();
                assertEquals(tasks.stream().map(Task::id).toList(), flattened);

                for (Batch batch : plan.batches()) {
                    assertTrue(batch.size() <= 4);
                    if (batch.tasks().stream().anyMatch(Task::isPhaseBound)) {
                        assertEquals(1, batch.size());
                        assertEquals(BatchMode.SEQUENTIAL, batch.mode());
                    }
                    if (batch.mode() == BatchMode.PARALLEL) {
                        assertEquals(1, batch.tasks().stream().map(Task::domain).distinct().count());
                        assertTrue(batch.tasks().stream().noneMatch(Task::isPhaseBound));
                    }
                }
                for (Group group : plan.groups()) {
                    assertTrue(group.batches().size() <= 3);
                    assertFalse(group.batches().isEmpty());
                }
            }
        }
    }
}
