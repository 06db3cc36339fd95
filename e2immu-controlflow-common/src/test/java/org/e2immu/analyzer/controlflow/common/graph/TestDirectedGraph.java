package org.e2immu.analyzer.controlflow.common.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestDirectedGraph {

    private static DirectedGraph<String> graph() {
        return new DirectedGraph.Builder<String>(Long::sum)
                .mergeEdge("a", "b", 1)
                .mergeEdge("b", "c", 2)
                .mergeEdge("a", "b", 4)
                .mergeEdge("c", "a", 2)
                .addVertex("d")
                .build();
    }

    @Test
    public void test1() {
        DirectedGraph<String> g = graph();
        assertEquals(4, g.size());
        assertEquals(5L, g.edgeValue("a", "b"));
        assertEquals(0L, g.edgeValue("b", "a"));
        assertEquals(Map.of("b", 5L), g.edges("a"));
        assertEquals(Map.of("a", 5L), g.reverseEdges("b"));
        assertTrue(g.edges("d").isEmpty());
        assertTrue(g.edges("unknown").isEmpty());
        assertEquals("a->5->b, b->2->c, c->2->a", g.toString());
    }

    @Test
    public void test2() {
        DirectedGraph<String> g = graph();
        assertEquals(Set.of("a", "b", "c"), g.reachableFrom(List.of("b"), v -> true));
        assertEquals(Set.of("b", "c"), g.reachableFrom(List.of("b"), v -> v == 2));
        assertEquals(Set.of("a", "c"), g.reachableTo(List.of("a"), v -> v == 2));
        assertEquals(Set.of("d"), g.reachableFrom(List.of("d"), v -> true));
    }

    @Test
    public void test3() {
        DirectedGraph<String> sub = graph().subGraph(Set.of("a", "b", "d"));
        assertEquals(3, sub.size());
        assertFalse(sub.contains("c"));
        assertEquals("a->x->b", sub.toString(";", v -> "x"));
        assertTrue(sub.reverseEdges("a").isEmpty());
    }
}
