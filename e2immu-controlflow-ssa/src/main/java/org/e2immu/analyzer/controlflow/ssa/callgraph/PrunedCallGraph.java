package org.e2immu.analyzer.controlflow.ssa.callgraph;

import org.e2immu.analyzer.controlflow.common.ast.*;
import org.e2immu.analyzer.controlflow.common.graph.DirectedGraph;
import org.e2immu.analyzer.controlflow.ssa.variable.AssignableDefinition;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;
import org.e2immu.analyzer.controlflow.ssa.variable.VariableAccesses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/*
Answers, per field, property or captured local variable, which callables may write or read it when called.

A callable writes a target when it writes it directly, or calls a callable that does. Writes through 'this' are
propagated along intra-instance edges only (own-instance setters); writes to a qualified instance, and all writes
seen through a cross-instance call, along all edges.

When pruning, the reachability computations run on the subgraph of callables that are both reachable from a
callable referencing the target, and that can reach one of the direct writers (or readers). This gives the same
answers for every call made by a referencing callable. Results are cached; all methods are thread-safe.
 */
public class PrunedCallGraph implements CallEffects {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrunedCallGraph.class);

    public record Key(Object target, boolean write) {
    }

    /*
    for readers, only 'general' is relevant
     */
    public record Setters(Set<Callable> ownInstance, Set<Callable> aliasing, Set<Callable> general, int graphSize) {
    }

    private final ComputeCallGraph computeCallGraph;
    private final DirectedGraph<Callable> graph;
    private final boolean prune;
    private final Map<Object, Set<Callable>> referencing = new HashMap<>();
    private final Map<Object, Set<Callable>> thisWriters = new HashMap<>();
    private final Map<Object, Set<Callable>> qualifiedWriters = new HashMap<>();
    private final Map<Object, Set<Callable>> capturedWriters = new HashMap<>();
    private final Map<Object, Set<Callable>> readers = new HashMap<>();
    private final Map<Key, Setters> cache = new ConcurrentHashMap<>();

    public PrunedCallGraph(ComputeCallGraph computeCallGraph, Collection<VariableAccesses> accesses, boolean prune) {
        this.computeCallGraph = computeCallGraph;
        this.graph = computeCallGraph.graph();
        this.prune = prune;
        for (VariableAccesses va : accesses) {
            Callable callable = va.callable();
            for (VariableAccesses.ReadAccess read : va.reads()) {
                SourceVariable v = read.variable();
                add(referencing, v, callable);
                if (v.member() != null || v.isCaptured()) add(readers, v, callable);
            }
            for (AssignableDefinition write : va.writes()) {
                SourceVariable v = write.variable();
                add(referencing, v, callable);
                if (v instanceof SourceVariable.PlainFieldOrProp) {
                    add(thisWriters, v, callable);
                } else if (v instanceof SourceVariable.QualifiedFieldOrProp) {
                    add(qualifiedWriters, v, callable);
                } else if (v.isCaptured()) {
                    add(capturedWriters, v, callable);
                }
            }
        }
    }

    private static void add(Map<Object, Set<Callable>> map, SourceVariable v, Callable callable) {
        map.computeIfAbsent(key(v), k -> new LinkedHashSet<>()).add(callable);
    }

    public static Object key(SourceVariable v) {
        if (v instanceof SourceVariable.LocalScopeVariable lsv) return lsv.variable();
        return v.member();
    }

    private static Set<Callable> get(Map<Object, Set<Callable>> map, Object key) {
        Set<Callable> set = map.get(key);
        return set == null ? Set.of() : set;
    }

    public DirectedGraph<Callable> graph() {
        return graph;
    }

    public Setters writers(Object target) {
        return cache.computeIfAbsent(new Key(target, true), this::computeWriters);
    }

    public Setters readers(Object target) {
        return cache.computeIfAbsent(new Key(target, false), this::computeReaders);
    }

    private Setters computeWriters(Key key) {
        Set<Callable> direct = new LinkedHashSet<>(get(thisWriters, key.target));
        direct.addAll(get(qualifiedWriters, key.target));
        direct.addAll(get(capturedWriters, key.target));
        DirectedGraph<Callable> g = subGraph(key, direct);
        Set<Callable> ownInstance = g.reachableTo(inGraph(g, get(thisWriters, key.target)),
                ComputeCallGraph::isIntraInstance);
        Set<Callable> aliasing = g.reachableTo(inGraph(g, get(qualifiedWriters, key.target)), v -> true);
        Set<Callable> general = g.reachableTo(inGraph(g, direct), v -> true);
        return new Setters(Set.copyOf(ownInstance), Set.copyOf(aliasing), Set.copyOf(general), g.size());
    }

    private Setters computeReaders(Key key) {
        Set<Callable> direct = get(readers, key.target);
        DirectedGraph<Callable> g = subGraph(key, direct);
        Set<Callable> general = g.reachableTo(inGraph(g, direct), v -> true);
        return new Setters(Set.of(), Set.of(), Set.copyOf(general), g.size());
    }

    private DirectedGraph<Callable> subGraph(Key key, Set<Callable> direct) {
        if (!prune) return graph;
        Set<Callable> from = graph.reachableFrom(get(referencing, key.target), v -> true);
        Set<Callable> to = graph.reachableTo(direct, v -> true);
        Set<Callable> keep = from.stream().filter(to::contains).collect(Collectors.toUnmodifiableSet());
        DirectedGraph<Callable> sub = graph.subGraph(keep);
        LOGGER.debug("Pruned call graph for {} ({}): {} of {} callables", key.target,
                key.write ? "write" : "read", sub.size(), graph.size());
        return sub;
    }

    private static List<Callable> inGraph(DirectedGraph<Callable> g, Set<Callable> callables) {
        return callables.stream().filter(g::contains).toList();
    }

    @Override
    public List<CallTarget> callTargets(Element element) {
        return computeCallGraph.callTargets(element);
    }

    @Override
    public boolean mayWrite(CallTarget target, SourceVariable variable) {
        Setters setters = writers(key(variable));
        Callable callee = target.callee();
        if (variable instanceof SourceVariable.PlainFieldOrProp && !variable.member().isStatic()
            && target.intraInstance()) {
            return setters.ownInstance.contains(callee) || setters.aliasing.contains(callee);
        }
        return setters.general.contains(callee);
    }

    @Override
    public boolean mayRead(CallTarget target, SourceVariable variable) {
        return readers(key(variable)).general.contains(target.callee());
    }

    @Override
    public Set<LambdaInfo> closuresAccessing(LocalVariable variable) {
        Set<LambdaInfo> set = new LinkedHashSet<>();
        for (Callable c : get(readers, variable)) if (c instanceof LambdaInfo li) set.add(li);
        for (Callable c : get(capturedWriters, variable)) if (c instanceof LambdaInfo li) set.add(li);
        return set;
    }

    @Override
    public Set<LambdaInfo> closuresReading(CallTarget target, LocalVariable variable) {
        Set<Callable> reachable = graph.reachableFrom(List.of(target.callee()), v -> true);
        Set<LambdaInfo> set = new LinkedHashSet<>();
        for (Callable c : get(readers, variable)) {
            if (c instanceof LambdaInfo li && reachable.contains(li)) set.add(li);
        }
        return set;
    }

    @Override
    public boolean reaches(CallTarget target, Callable callable) {
        return graph.reachableFrom(List.of(target.callee()), v -> true).contains(callable);
    }
}
