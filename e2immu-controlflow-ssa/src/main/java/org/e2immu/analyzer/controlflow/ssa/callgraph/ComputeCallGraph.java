package org.e2immu.analyzer.controlflow.ssa.callgraph;

import org.e2immu.analyzer.controlflow.common.ast.*;
import org.e2immu.analyzer.controlflow.common.graph.DirectedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
call graph of a program.

direction of arrow: caller -> callee. Edge values are bit sets: INTRA_INSTANCE when the callee runs on the same
instance as the caller, CROSS_INSTANCE otherwise. Edges are merged with '|'.

Besides method calls and object creations, the graph contains edges for
- reads and writes of properties that are not field-like, to their getter and setter;
- delegate calls, to the lambdas the delegate may hold;
- lambdas passed as argument to a callable without body: we cannot see what it does with them, so they are
  assumed to be invoked.
 */
public class ComputeCallGraph {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputeCallGraph.class);

    public static final long INTRA_INSTANCE = 1;
    public static final long CROSS_INSTANCE = 2;

    private final Program program;
    private final DirectedGraph.Builder<Callable> builder = new DirectedGraph.Builder<>((v1, v2) -> v1 | v2);
    private final Map<MethodInfo, List<MethodInfo>> overriders = new HashMap<>();
    private final Map<Element, List<CallTarget>> callTargets = new IdentityHashMap<>();

    private DelegateFlow delegateFlow;
    private DirectedGraph<Callable> graph;

    public ComputeCallGraph(Program program) {
        this.program = program;
    }

    public static boolean isIntraInstance(long value) {
        return (value & INTRA_INSTANCE) != 0;
    }

    public static String print(DirectedGraph<Callable> graph) {
        return graph.toString(", ", ComputeCallGraph::edgeValuePrinter);
    }

    public static String edgeValuePrinter(long value) {
        StringBuilder sb = new StringBuilder();
        if ((value & INTRA_INSTANCE) != 0) sb.append("I");
        if ((value & CROSS_INSTANCE) != 0) sb.append("X");
        return sb.toString();
    }

    public ComputeCallGraph go() {
        program.methodStream().forEach(mi -> {
            builder.addVertex(mi);
            for (MethodInfo o = mi.overrides(); o != null; o = o.overrides()) {
                overriders.computeIfAbsent(o, k -> new ArrayList<>()).add(mi);
            }
        });
        program.callables().forEach(builder::addVertex);
        delegateFlow = new DelegateFlow(program, this::dispatch);
        for (Callable callable : program.callables()) {
            go(callable);
        }
        graph = builder.build();
        LOGGER.info("Computed call graph of {} callables, {} call sites", graph.size(), callTargets.size());
        return this;
    }

    public DirectedGraph<Callable> graph() {
        return graph;
    }

    public DelegateFlow delegateFlow() {
        return delegateFlow;
    }

    /*
    the callables that may run when the element is evaluated; empty for elements that do not call
     */
    public List<CallTarget> callTargets(Element element) {
        List<CallTarget> list = callTargets.get(element);
        return list == null ? List.of() : list;
    }

    /*
    the method itself, and, when it is virtual, all methods overriding it
     */
    List<MethodInfo> dispatch(MethodInfo methodInfo) {
        if (!methodInfo.isVirtual()) return List.of(methodInfo);
        List<MethodInfo> list = new ArrayList<>();
        list.add(methodInfo);
        list.addAll(overriders.getOrDefault(methodInfo, List.of()));
        return list;
    }

    private void go(Callable callable) {
        Set<Element> plainAssignmentTargets = Collections.newSetFromMap(new IdentityHashMap<>());
        callable.body().stream().forEach(e -> {
            if (e instanceof Assignment a && !a.isCompound()) plainAssignmentTargets.add(a.target());
        });
        callable.body().stream().forEach(e -> {
            if (e instanceof MethodCall mc) {
                for (MethodInfo target : dispatch(mc.method())) {
                    add(callable, e, new CallTarget(target, mc.isThisPreserving()));
                    lambdasPassedToBodiless(callable, e, target, mc.arguments());
                }
            } else if (e instanceof ObjectCreation oc) {
                add(callable, e, new CallTarget(oc.constructor(), false));
                lambdasPassedToBodiless(callable, e, oc.constructor(), oc.arguments());
            } else if (e instanceof DelegateCall dc) {
                for (LambdaInfo li : delegateFlow.lambdas(dc.delegate())) {
                    add(callable, e, new CallTarget(li, false));
                }
            } else if (e instanceof MemberAccess ma && ma.member() instanceof PropertyInfo pi && !pi.isFieldLike()
                       && !plainAssignmentTargets.contains(e)) {
                add(callable, e, new CallTarget(pi.getter(), ma.hasThisQualifier()));
            } else if (e instanceof Assignment a && a.target() instanceof MemberAccess ma
                       && ma.member() instanceof PropertyInfo pi && !pi.isFieldLike()) {
                add(callable, e, new CallTarget(pi.setter(), ma.hasThisQualifier()));
            }
        });
    }

    private void lambdasPassedToBodiless(Callable caller, Element call, MethodInfo target,
                                         List<Expression> arguments) {
        if (target.hasBody()) return;
        for (Expression argument : arguments) {
            for (LambdaInfo li : delegateFlow.lambdas(argument)) {
                add(caller, call, new CallTarget(li, false));
            }
        }
    }

    private void add(Callable caller, Element element, CallTarget target) {
        List<CallTarget> list = callTargets.computeIfAbsent(element, e -> new ArrayList<>());
        if (!list.contains(target)) list.add(target);
        builder.mergeEdge(caller, target.callee(), target.intraInstance() ? INTRA_INSTANCE : CROSS_INSTANCE);
    }
}
