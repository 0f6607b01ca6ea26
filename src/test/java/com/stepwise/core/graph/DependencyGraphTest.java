package com.stepwise.core.graph;

import com.stepwise.core.model.DomainTag;
import com.stepwise.core.model.Task;
import com.stepwise.core.model.TddPhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static Task task(String id, String pred) {
        return new Task(id, "Do " + id, TddPhase.NONE, DomainTag.GENERAL, pred, List.of(), 0);
    }

    private final DependencyGraph graph = new DependencyGraph(List.of(
            task("T1", null), task("T2", "T1"), task("T3", null), task("T4", "T2"), task("T5", "T1")));

    @Test
    @DisplayName("transitive dependents are returned in list order")
    void transitiveDependents() {
        assertEquals(List.of("T2", "T4", "T5"), graph.transitiveDependents("T1"));
        assertEquals(List.of("T4"), graph.transitiveDependents("T2"));
        assertEquals(List.of(), graph.transitiveDependents("T3"));
    }

    @Test
    @DisplayName("direct dependents lookup")
    void directDependents() {
        assertEquals(List.of("T2", "T5"), graph.directDependents("T1"));
        assertEquals(List.of(), graph.directDependents("T9"));
    }
}
