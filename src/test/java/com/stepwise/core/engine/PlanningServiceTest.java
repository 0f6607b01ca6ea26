package com.stepwise.core.engine;

import com.stepwise.core.graph.DependencyException;
import com.stepwise.core.graph.DependencyResolver;
import com.stepwise.core.model.ExecutionPlan;
import com.stepwise.core.parser.KeywordDomainClassifier;
import com.stepwise.core.parser.ParseException;
import com.stepwise.core.parser.TaskParser;
import com.stepwise.core.scheduler.BatchScheduler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanningServiceTest {

    @TempDir
    Path tempDir;

    private final PlanningService planningService = new PlanningService(
            new TaskParser(new KeywordDomainClassifier()), new DependencyResolver(), new BatchScheduler(4, 3));

    @Test
    void plansTaskFileEndToEnd() throws Exception {
        Path file = tempDir.resolve("tasks.md");
        Files.writeString(file, """
                - [ ] T001 [RED] Write failing test for discount rules
                - [ ] T002 [GREEN] Implement discount service
                - [ ] T003 Add orders endpoint
                - [ ] T004 Add customer api handler
                - [ ] T005 Build checkout page component
                """);

        ExecutionPlan plan = planningService.plan(file);

        assertEquals("T001", plan.task("T002").orElseThrow().predecessorRef());
        assertEquals(List.of(List.of("T001"), List.of("T002"), List.of("T003", "T004"), List.of("T005")),
                plan.batches().stream().map(b -> b.taskIds()).toList());
        assertEquals(List.of("T001", "T002", "T003", "T004"), plan.groups().get(0).taskIds());
        assertEquals(2, plan.groupOf("T005").orElseThrow().index());
    }

    @Test
    void brokenChainFailsBeforeScheduling() {
        var e = assertThrows(DependencyException.class,
                () -> planningService.plan(new TaskParser(new KeywordDomainClassifier())
                        .parse(List.of("T1 Add orders endpoint", "T2 [GREEN] Implement discount service"))));
        assertEquals(List.of("T2"), e.taskIds());
    }

    @Test
    void malformedLineFailsBeforeResolving() throws Exception {
        Path file = tempDir.resolve("tasks.md");
        Files.writeString(file, "T002 first\nT001 second\n");

        assertThrows(ParseException.class, () -> planningService.plan(file));
    }
}
