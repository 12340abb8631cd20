package com.stagegate.core.scheduler;

import com.stagegate.core.RecordFixtures;
import com.stagegate.core.model.Stage;
import com.stagegate.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DependencyGraph}.
 */
class DependencyGraphTest {

    private static Task task(String id, String... blockedBy) {
        return RecordFixtures.pendingTask(id, Stage.IMPLEMENT, "out/" + id + ".log", blockedBy);
    }

    @Test
    @DisplayName("orders dependents after their dependencies, keeping batch order for ties")
    void topologicalOrder() {
        var graph = DependencyGraph.of(List.of(task("C", "A", "B"), task("A"), task("B", "A")), Set.of());

        List<String> order = graph.topologicalOrder().stream().map(Task::id).toList();

        assertEquals(List.of("A", "B", "C"), order);
        assertEquals(List.of("A"), graph.independent().stream().map(Task::id).toList());
    }

    @Test
    @DisplayName("separates dependencies on tasks outside the batch")
    void externalDependencies() {
        var graph = DependencyGraph.of(List.of(task("X", "PLAN-1"), task("Y", "X")), Set.of("PLAN-1"));

        assertEquals(List.of("PLAN-1"), graph.externalDependencies("X"));
        assertTrue(graph.internalDependencies("X").isEmpty());
        assertEquals(List.of("X"), graph.internalDependencies("Y"));
        assertEquals(List.of("X"), graph.independent().stream().map(Task::id).toList());
    }

    @Test
    @DisplayName("rejects a reference that resolves nowhere")
    void unknownReference() {
        var ex = assertThrows(UnknownDependencyException.class,
                () -> DependencyGraph.of(List.of(task("X", "ghost")), Set.of()));

        assertEquals("Task X is blocked by unknown task ghost", ex.getMessage());
    }

    @Test
    @DisplayName("names the cycle when the batch is not a DAG")
    void cycle() {
        var graph = DependencyGraph.of(List.of(task("A", "C"), task("B", "A"), task("C", "B"), task("D")), Set.of());

        var ex = assertThrows(DependencyCycleException.class, graph::topologicalOrder);

        assertEquals(List.of("A", "C", "B", "A"), ex.cycle());
        assertEquals("Dependency cycle: A -> C -> B -> A", ex.getMessage());
    }
}
