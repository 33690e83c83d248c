package com.specgate.core.validator;

import com.specgate.core.model.TaskBlock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static TaskBlock task(String id, String... deps) {
        return new TaskBlock(id, null, null, null, List.of(deps), 1);
    }

    @Test
    @DisplayName("self dependency is a cycle of one")
    void selfLoop() {
        var graph = new DependencyGraph(List.of(task("1.1", "1.1")));
        assertEquals(List.of("1.1", "1.1"), graph.findFirstCycle().orElseThrow());
    }

    @Test
    @DisplayName("cycle path starts where the back edge points")
    void cycleInsidePath() {
        var graph = new DependencyGraph(List.of(
                task("1.1", "1.2"),
                task("1.2", "1.3"),
                task("1.3", "1.4"),
                task("1.4", "1.2")));

        assertEquals(List.of("1.2", "1.3", "1.4", "1.2"), graph.findFirstCycle().orElseThrow());
    }

    @Test
    @DisplayName("only the first of two disjoint cycles is reported")
    void firstCycleOnly() {
        var graph = new DependencyGraph(List.of(
                task("1.1", "1.2"), task("1.2", "1.1"),
                task("2.1", "2.2"), task("2.2", "2.1")));

        assertEquals(List.of("1.1", "1.2", "1.1"), graph.findFirstCycle().orElseThrow());
    }

    @Test
    @DisplayName("missing dependencies are collected and left out of the graph")
    void missing() {
        var graph = new DependencyGraph(List.of(task("1.1", "0.9"), task("1.2", "1.1")));

        assertEquals(1, graph.missingDependencies().size());
        assertEquals("0.9", graph.missingDependencies().get(0).dependency());
        assertTrue(graph.findFirstCycle().isEmpty());
    }

    @Test
    @DisplayName("long dependency chains do not overflow the stack")
    void longChain() {
        var tasks = new ArrayList<TaskBlock>();
        int n = 50_000;
        for (int i = 0; i < n; i++) {
            tasks.add(i + 1 < n ? task("t" + i, "t" + (i + 1)) : task("t" + i));
        }
        assertTrue(new DependencyGraph(tasks).findFirstCycle().isEmpty());

        tasks.set(n - 1, task("t" + (n - 1), "t0"));
        List<String> cycle = new DependencyGraph(tasks).findFirstCycle().orElseThrow();
        assertEquals(n + 1, cycle.size());
    }
}
