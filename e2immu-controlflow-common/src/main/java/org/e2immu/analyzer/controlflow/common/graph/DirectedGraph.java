package org.e2immu.analyzer.controlflow.common.graph;

import java.util.*;
import java.util.function.LongBinaryOperator;
import java.util.function.LongFunction;
import java.util.function.LongPredicate;
import java.util.stream.Collectors;

/*
Immutable directed graph with long edge values. Edge values are typically bit sets, merged with '|' or '+'
when the same edge is added more than once.

Vertex and edge iteration order is insertion order.
 */
public class DirectedGraph<T> {
    private final Map<T, Map<T, Long>> edges;
    private final Map<T, Map<T, Long>> reverseEdges;

    private DirectedGraph(Map<T, Map<T, Long>> edges) {
        this.edges = edges;
        Map<T, Map<T, Long>> reverse = new LinkedHashMap<>();
        edges.keySet().forEach(v -> reverse.put(v, new LinkedHashMap<>()));
        edges.forEach((from, map) -> map.forEach((to, value) -> reverse.get(to).put(from, value)));
        this.reverseEdges = reverse;
    }

    public static class Builder<T> {
        private final LongBinaryOperator merger;
        private final Map<T, Map<T, Long>> edges = new LinkedHashMap<>();

        public Builder(LongBinaryOperator merger) {
            this.merger = merger;
        }

        public Builder<T> addVertex(T t) {
            edges.computeIfAbsent(t, k -> new LinkedHashMap<>());
            return this;
        }

        public Builder<T> mergeEdge(T from, T to, long value) {
            addVertex(to);
            edges.computeIfAbsent(from, k -> new LinkedHashMap<>())
                    .merge(to, value, (v1, v2) -> merger.applyAsLong(v1, v2));
            return this;
        }

        public DirectedGraph<T> build() {
            Map<T, Map<T, Long>> copy = new LinkedHashMap<>();
            edges.forEach((from, map) -> copy.put(from, Collections.unmodifiableMap(new LinkedHashMap<>(map))));
            return new DirectedGraph<>(Collections.unmodifiableMap(copy));
        }
    }

    public Set<T> vertices() {
        return edges.keySet();
    }

    public boolean contains(T t) {
        return edges.containsKey(t);
    }

    public Map<T, Long> edges(T from) {
        Map<T, Long> map = edges.get(from);
        return map == null ? Map.of() : map;
    }

    public Map<T, Long> reverseEdges(T to) {
        Map<T, Long> map = reverseEdges.get(to);
        return map == null ? Map.of() : map;
    }

    public long edgeValue(T from, T to) {
        Long value = edges(from).get(to);
        return value == null ? 0L : value;
    }

    public int size() {
        return edges.size();
    }

    /*
    the vertices reachable from the start vertices, following only edges whose value is accepted;
    the start vertices are included
     */
    public Set<T> reachableFrom(Collection<T> start, LongPredicate acceptEdge) {
        return reachable(start, acceptEdge, edges);
    }

    /*
    the vertices from which one of the end vertices can be reached; the end vertices are included
     */
    public Set<T> reachableTo(Collection<T> end, LongPredicate acceptEdge) {
        return reachable(end, acceptEdge, reverseEdges);
    }

    private static <T> Set<T> reachable(Collection<T> start, LongPredicate acceptEdge, Map<T, Map<T, Long>> edges) {
        Set<T> visited = new LinkedHashSet<>();
        Deque<T> toDo = new ArrayDeque<>();
        for (T t : start) {
            if (visited.add(t)) toDo.add(t);
        }
        while (!toDo.isEmpty()) {
            T t = toDo.poll();
            Map<T, Long> map = edges.get(t);
            if (map != null) {
                map.forEach((next, value) -> {
                    if (acceptEdge.test(value) && visited.add(next)) toDo.add(next);
                });
            }
        }
        return visited;
    }

    /*
    the graph restricted to the given vertices, with the edges between them
     */
    public DirectedGraph<T> subGraph(Set<T> keep) {
        Map<T, Map<T, Long>> map = new LinkedHashMap<>();
        edges.forEach((from, tos) -> {
            if (keep.contains(from)) {
                Map<T, Long> kept = new LinkedHashMap<>();
                tos.forEach((to, value) -> {
                    if (keep.contains(to)) kept.put(to, value);
                });
                map.put(from, Collections.unmodifiableMap(kept));
            }
        });
        return new DirectedGraph<>(Collections.unmodifiableMap(map));
    }

    public String toString(String separator, LongFunction<String> edgeValuePrinter) {
        return edges.entrySet().stream()
                .flatMap(e -> e.getValue().entrySet().stream()
                        .map(e2 -> e.getKey() + "->" + edgeValuePrinter.apply(e2.getValue()) + "->" + e2.getKey()))
                .sorted()
                .collect(Collectors.joining(separator));
    }

    @Override
    public String toString() {
        return toString(", ", String::valueOf);
    }
}
