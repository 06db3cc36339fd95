package org.e2immu.analyzer.controlflow.ssa;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowGraph;
import org.e2immu.analyzer.controlflow.cfg.ControlFlowGraphBuilder;
import org.e2immu.analyzer.controlflow.common.AnalyzerException;
import org.e2immu.analyzer.controlflow.common.ast.*;
import org.e2immu.analyzer.controlflow.common.graph.DirectedGraph;
import org.e2immu.analyzer.controlflow.common.util.TimedLogger;
import org.e2immu.analyzer.controlflow.ssa.callgraph.CallTarget;
import org.e2immu.analyzer.controlflow.ssa.callgraph.ComputeCallGraph;
import org.e2immu.analyzer.controlflow.ssa.callgraph.PrunedCallGraph;
import org.e2immu.analyzer.controlflow.ssa.definition.Definition;
import org.e2immu.analyzer.controlflow.ssa.definition.ImplicitCallDefinition;
import org.e2immu.analyzer.controlflow.ssa.definition.ImplicitEntryDefinition;
import org.e2immu.analyzer.controlflow.ssa.impl.CallableSsaImpl;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariableResolver;
import org.e2immu.analyzer.controlflow.ssa.variable.VariableAccesses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/*
Entry point of the SSA analysis of a program.

The construction resolves the variable accesses of all callables and computes the call graph. The SSA form of a
callable is computed on demand and cached; analyze() computes all of them. Thread-safe.
 */
public class ProgramAnalysis {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgramAnalysis.class);
    private static final TimedLogger TIMED_LOGGER = new TimedLogger(LOGGER, 1000L);

    public record Configuration(boolean parallel,
                                boolean storeErrors,
                                boolean pruneCallGraph,
                                boolean trackAllFieldsAndProperties) {
        public static final Configuration DEFAULT = new Builder().build();

        public static class Builder {
            private boolean parallel;
            private boolean storeErrors;
            private boolean pruneCallGraph = true;
            private boolean trackAllFieldsAndProperties;

            public Builder setParallel(boolean parallel) {
                this.parallel = parallel;
                return this;
            }

            public Builder setStoreErrors(boolean storeErrors) {
                this.storeErrors = storeErrors;
                return this;
            }

            public Builder setPruneCallGraph(boolean pruneCallGraph) {
                this.pruneCallGraph = pruneCallGraph;
                return this;
            }

            public Builder setTrackAllFieldsAndProperties(boolean trackAllFieldsAndProperties) {
                this.trackAllFieldsAndProperties = trackAllFieldsAndProperties;
                return this;
            }

            public Configuration build() {
                return new Configuration(parallel, storeErrors, pruneCallGraph, trackAllFieldsAndProperties);
            }
        }
    }

    public interface Output {
        /*
        in the order of Program.callables(); callables whose analysis failed are absent
         */
        Map<Callable, CallableSsa> results();

        List<AnalyzerException> analyzerExceptions();
    }

    public record OutputImpl(Map<Callable, CallableSsa> results,
                             List<AnalyzerException> analyzerExceptions) implements Output {
    }

    private final Program program;
    private final Configuration configuration;
    private final ControlFlowGraphBuilder controlFlowGraphBuilder;
    private final SourceVariableResolver resolver;
    private final Map<Callable, VariableAccesses> accesses = new LinkedHashMap<>();
    private final ComputeCallGraph computeCallGraph;
    private final PrunedCallGraph prunedCallGraph;
    private final Map<Callable, CallableSsa> ssaCache = new ConcurrentHashMap<>();

    public ProgramAnalysis(Factory factory, Program program) {
        this(factory, program, Configuration.DEFAULT);
    }

    public ProgramAnalysis(Factory factory, Program program, Configuration configuration) {
        this.program = program;
        this.configuration = configuration;
        this.controlFlowGraphBuilder = new ControlFlowGraphBuilder(factory);
        this.resolver = new SourceVariableResolver(configuration.trackAllFieldsAndProperties());
        for (Callable callable : program.callables()) {
            accesses.put(callable, resolver.resolve(callable));
        }
        this.computeCallGraph = new ComputeCallGraph(program).go();
        this.prunedCallGraph = new PrunedCallGraph(computeCallGraph, accesses.values(),
                configuration.pruneCallGraph());
        LOGGER.info("Prepared {} callables in {} types", accesses.size(), program.types().size());
    }

    public Configuration configuration() {
        return configuration;
    }

    public DirectedGraph<Callable> callGraph() {
        return computeCallGraph.graph();
    }

    public List<CallTarget> callTargets(Element element) {
        return computeCallGraph.callTargets(element);
    }

    public PrunedCallGraph prunedCallGraph() {
        return prunedCallGraph;
    }

    public VariableAccesses variableAccesses(Callable callable) {
        VariableAccesses va = accesses.get(callable);
        if (va == null) throw new IllegalArgumentException("Not a callable with body in the program: " + callable);
        return va;
    }

    /*
    computed once per callable; failures are not cached
     */
    public CallableSsa ssaOf(Callable callable) {
        VariableAccesses va = variableAccesses(callable);
        return ssaCache.computeIfAbsent(callable, c -> {
            ControlFlowGraph cfg = controlFlowGraphBuilder.build(c);
            return new CallableSsaImpl(cfg, va, prunedCallGraph);
        });
    }

    public Output analyze() {
        List<AnalyzerException> analyzerExceptions = Collections.synchronizedList(new LinkedList<>());
        List<Callable> callables = program.callables();
        AtomicInteger count = new AtomicInteger();
        Stream<Callable> stream = configuration.parallel() ? callables.parallelStream() : callables.stream();
        stream.forEach(callable -> {
            try {
                ssaOf(callable);
            } catch (RuntimeException re) {
                LOGGER.error("Caught exception analyzing {}", callable, re);
                if (configuration.storeErrors()) {
                    analyzerExceptions.add(new AnalyzerException(callable, re));
                } else {
                    throw re;
                }
            }
            TIMED_LOGGER.info("Analyzed {} of {} callables", count.incrementAndGet(), callables.size());
        });
        Map<Callable, CallableSsa> results = new LinkedHashMap<>();
        for (Callable callable : callables) {
            CallableSsa ssa = ssaCache.get(callable);
            if (ssa != null) results.put(callable, ssa);
        }
        LOGGER.info("Analyzed {} callables, {} errors", results.size(), analyzerExceptions.size());
        return new OutputImpl(Collections.unmodifiableMap(results), List.copyOf(analyzerExceptions));
    }

    /*
    the entry definitions, in the closures, of the captured variable that the definition flows into;
    closures nested in a capturing closure are included when they access the variable
     */
    public List<Definition> closureEntryDefinitions(Definition definition) {
        if (!(definition.variable() instanceof SourceVariable.LocalScopeVariable lsv)) return List.of();
        List<Definition> result = new ArrayList<>();
        Set<LambdaInfo> accessing = prunedCallGraph.closuresAccessing(lsv.variable());
        for (LambdaInfo closure : definition.flowsIntoClosure()) {
            for (LambdaInfo li : withNested(closure)) {
                if (!accessing.contains(li)) continue;
                CallableSsa ssa = ssaOf(li);
                SourceVariable captured = new SourceVariable.LocalScopeVariable(li, lsv.variable(),
                        lsv.declaringCallable());
                for (Definition d : ssa.definitionsOf(captured)) {
                    if (d instanceof ImplicitEntryDefinition) result.add(d);
                }
            }
        }
        return result;
    }

    private static List<LambdaInfo> withNested(LambdaInfo lambdaInfo) {
        List<LambdaInfo> list = new ArrayList<>();
        list.add(lambdaInfo);
        Program.lambdasIn(lambdaInfo).forEach(li -> list.addAll(withNested(li)));
        return list;
    }

    /*
    for a definition of a captured variable that is live at the exit of its closure: the implicit call definitions
    in the declaring callable, at calls that may run the closure
     */
    public List<Definition> closureOutflowDefinitions(Definition definition) {
        if (!definition.flowsOutOfClosure()) return List.of();
        SourceVariable.LocalScopeVariable lsv = (SourceVariable.LocalScopeVariable) definition.variable();
        Callable declaring = lsv.declaringCallable();
        Callable closure = lsv.callable();
        CallableSsa ssa = ssaOf(declaring);
        SourceVariable inDeclaring = new SourceVariable.LocalScopeVariable(declaring, lsv.variable(), declaring);
        List<Definition> result = new ArrayList<>();
        for (Definition d : ssa.definitionsOf(inDeclaring)) {
            if (d instanceof ImplicitCallDefinition) {
                List<CallTarget> targets = computeCallGraph.callTargets(d.node().element());
                if (targets.stream().anyMatch(t -> prunedCallGraph.reaches(t, closure))) result.add(d);
            }
        }
        return result;
    }
}
