package com.linecalc.app.models;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    @Test
    void testForwardAndReverseEdges() {
        DependencyGraph graph = DependencyGraph.fromLines(List.of("1 =", "\\1 + 1 =", "\\1 + \\2 =", "text"));
        assertEquals(Set.of(1), graph.getForwardGraph().get(2));
        assertEquals(Set.of(1, 2), graph.getForwardGraph().get(3));
        assertEquals(Set.of(2, 3), graph.getReverseGraph().get(1));
        assertTrue(graph.getForwardGraph().get(4).isEmpty());
    }

    /**
     * Cycles terminate and the start line is never its own dependent.
     */
    @Test
    void testTransitiveDependentsWithCycle() {
        DependencyGraph graph = DependencyGraph.fromLines(List.of("\\3 =", "\\1 =", "\\2 ="));
        assertEquals(List.of(2, 3), graph.transitiveDependents(1));
        assertEquals(List.of(2), graph.directDependents(1));
    }

    @Test
    void testUnknownLineHasNoDependents() {
        DependencyGraph graph = DependencyGraph.fromLines(List.of("1 ="));
        assertEquals(List.of(), graph.directDependents(42));
        assertEquals(List.of(), graph.transitiveDependents(42));
    }
}
