package org.e2immu.analyzer.controlflow.ssa.impl;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowGraph;
import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlocks;
import org.e2immu.analyzer.controlflow.cfg.dominance.Dominance;
import org.e2immu.analyzer.controlflow.common.ast.*;
import org.e2immu.analyzer.controlflow.ssa.CallableSsa;
import org.e2immu.analyzer.controlflow.ssa.callgraph.CallEffects;
import org.e2immu.analyzer.controlflow.ssa.callgraph.CallTarget;
import org.e2immu.analyzer.controlflow.ssa.definition.*;
import org.e2immu.analyzer.controlflow.ssa.liveness.Liveness;
import org.e2immu.analyzer.controlflow.ssa.variable.AssignableDefinition;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;
import org.e2immu.analyzer.controlflow.ssa.variable.VariableAccesses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/*
Construction of the sparse SSA form of one callable, in the following steps:

1. collect the references: reads and writes in the source, implicit writes at entry, at calls and when a
   qualifier changes, pseudo-reads at calls and at the exit node;
2. compute liveness on the basic blocks;
3. create a definition for every write after which the variable is live; writes of untracked variables always
   get a definition;
4. place phi nodes in the iterated dominance frontier of the defining blocks, where the variable is live on entry;
5. resolve every read to the definition reaching it, walking up the dominator tree.

Everything is computed in the constructor; afterwards the object is immutable.
 */
public class CallableSsaImpl implements CallableSsa {
    private static final Logger LOGGER = LoggerFactory.getLogger(CallableSsaImpl.class);

    private record PseudoRead(ControlFlowNode node, SourceVariable variable, List<CallTarget> targets) {
    }

    private final Callable callable;
    private final ControlFlowGraph cfg;
    private final BasicBlocks basicBlocks;
    private final Dominance dominance;
    private final VariableAccesses accesses;
    private final CallEffects callEffects;
    private final Liveness liveness;

    private final Map<ControlFlowNode, Map<SourceVariable, Definition>> definitionAtNode = new HashMap<>();
    private final Map<BasicBlock, Map<SourceVariable, List<Definition>>> definitionsInBlock = new HashMap<>();
    private final Map<BasicBlock, Map<SourceVariable, PhiNode>> phis = new HashMap<>();
    private final List<Definition> definitions = new ArrayList<>();
    private final Map<SourceVariable, List<Definition>> definitionsOf = new HashMap<>();
    private final Map<SourceVariable, List<Read>> readsOf = new LinkedHashMap<>();
    private final Map<Element, List<Read>> readsAt = new IdentityHashMap<>();
    private final Map<Read, Definition> reaching = new HashMap<>();
    private final Map<Definition, List<Read>> readsOfDefinition = new IdentityHashMap<>();
    private final Map<Definition, List<Definition>> phiInputs = new IdentityHashMap<>();
    private final Map<Definition, Definition> priors = new IdentityHashMap<>();
    private final Map<SourceVariable, Definition> reachingExit = new HashMap<>();
    private final Map<PseudoRead, Definition> reachingPseudoReads = new HashMap<>();

    public CallableSsaImpl(ControlFlowGraph cfg, VariableAccesses accesses, CallEffects callEffects) {
        this.callable = cfg.callable();
        this.cfg = cfg;
        this.basicBlocks = cfg.basicBlocks();
        this.dominance = cfg.dominance();
        this.accesses = accesses;
        this.callEffects = callEffects;

        // step 1
        List<Liveness.Reference> references = new ArrayList<>();
        Map<ControlFlowNode, Map<SourceVariable, List<AssignableDefinition>>> explicitWrites = explicitWrites();
        explicitWrites.forEach((node, map) -> map.forEach((v, list) -> {
            if (accesses.isTracked(v)) {
                boolean certain = list.size() == 1 && list.get(0).isCertain();
                references.add(new Liveness.Reference(node, v, certain ? Liveness.Kind.CERTAIN_WRITE
                        : Liveness.Kind.UNCERTAIN_WRITE));
            }
        }));
        for (VariableAccesses.ReadAccess ra : accesses.reads()) {
            for (ControlFlowNode node : cfg.nodesOf(ra.element())) {
                Read read = new Read(node, ra.variable(), ra.element());
                readsOf.computeIfAbsent(ra.variable(), v -> new ArrayList<>()).add(read);
                readsAt.computeIfAbsent(ra.element(), e -> new ArrayList<>()).add(read);
                if (accesses.isTracked(ra.variable())) {
                    references.add(new Liveness.Reference(node, ra.variable(), Liveness.Kind.READ));
                }
            }
        }
        ControlFlowNode entry = cfg.entryNode();
        Set<SourceVariable> entryVariables = new LinkedHashSet<>();
        for (SourceVariable v : accesses.tracked()) {
            if (v.member() != null || v.isCaptured()) {
                entryVariables.add(v);
                references.add(new Liveness.Reference(entry, v, Liveness.Kind.CERTAIN_WRITE));
            }
        }
        Map<ControlFlowNode, Set<SourceVariable>> callWrites = new HashMap<>();
        List<PseudoRead> pseudoReads = new ArrayList<>();
        List<SourceVariable> callSensitive = accesses.tracked().stream().filter(this::isCallSensitive).toList();
        if (!callSensitive.isEmpty()) {
            for (ControlFlowNode node : cfg.nodes()) {
                if (node.element() == null) continue;
                List<CallTarget> targets = callEffects.callTargets(node.element());
                if (targets.isEmpty()) continue;
                for (SourceVariable v : callSensitive) {
                    if (targets.stream().anyMatch(t -> callEffects.mayRead(t, v))) {
                        pseudoReads.add(new PseudoRead(node, v, targets));
                        references.add(new Liveness.Reference(node, v, Liveness.Kind.READ));
                    }
                    if (targets.stream().anyMatch(t -> callEffects.mayWrite(t, v))) {
                        callWrites.computeIfAbsent(node, n -> new LinkedHashSet<>()).add(v);
                        references.add(new Liveness.Reference(node, v, Liveness.Kind.UNCERTAIN_WRITE));
                    }
                }
            }
        }
        Map<ControlFlowNode, Set<SourceVariable>> qualifierWrites = qualifierWrites(explicitWrites, callWrites);
        qualifierWrites.forEach((node, set) -> set.forEach(v ->
                references.add(new Liveness.Reference(node, v, Liveness.Kind.CERTAIN_WRITE))));
        ControlFlowNode exit = cfg.exitNode();
        List<SourceVariable> exitVariables = new ArrayList<>();
        if (exit != null) {
            for (SourceVariable v : accesses.tracked()) {
                if (isObservableAfterExit(v)) {
                    exitVariables.add(v);
                    references.add(new Liveness.Reference(exit, v, Liveness.Kind.READ));
                }
            }
        }

        // step 2
        this.liveness = new Liveness(basicBlocks, references);

        // step 3
        for (ControlFlowNode node : cfg.nodes()) {
            Map<SourceVariable, Definition> atNode = new LinkedHashMap<>();
            Map<SourceVariable, List<AssignableDefinition>> explicit = explicitWrites.getOrDefault(node, Map.of());
            BasicBlock block = basicBlocks.blockOf(node);
            explicit.forEach((v, list) -> {
                if (!accesses.isTracked(v) || liveness.liveAfter(node, v)) {
                    atNode.put(v, new ExplicitDefinition(this, node, block, list));
                }
            });
            for (SourceVariable v : qualifierWrites.getOrDefault(node, Set.of())) {
                if (!atNode.containsKey(v) && liveness.liveAfter(node, v)) {
                    atNode.put(v, new ImplicitQualifierDefinition(this, v, node, block));
                }
            }
            for (SourceVariable v : callWrites.getOrDefault(node, Set.of())) {
                if (!atNode.containsKey(v) && liveness.liveAfter(node, v)) {
                    atNode.put(v, new ImplicitCallDefinition(this, v, node, block));
                }
            }
            if (node == entry) {
                for (SourceVariable v : entryVariables) {
                    if (!atNode.containsKey(v) && liveness.liveAfter(node, v)) {
                        atNode.put(v, new ImplicitEntryDefinition(this, v, node, block));
                    }
                }
            }
            if (!atNode.isEmpty()) {
                definitionAtNode.put(node, atNode);
                atNode.forEach((v, d) -> definitionsInBlock.computeIfAbsent(block, b -> new HashMap<>())
                        .computeIfAbsent(v, vv -> new ArrayList<>()).add(d));
            }
        }
        Comparator<Definition> byIndex = Comparator.comparingInt(d -> basicBlocks.indexInBlock(d.node()));
        definitionsInBlock.values().forEach(map -> map.values().forEach(list -> list.sort(byIndex)));

        // step 4
        Map<SourceVariable, Set<BasicBlock>> definingBlocks = new HashMap<>();
        definitionsInBlock.forEach((block, map) -> map.keySet().forEach(v ->
                definingBlocks.computeIfAbsent(v, vv -> new HashSet<>()).add(block)));
        for (SourceVariable v : accesses.tracked()) {
            Set<BasicBlock> blocks = definingBlocks.get(v);
            if (blocks == null) continue;
            for (BasicBlock b : dominance.iteratedDominanceFrontier(blocks)) {
                if (liveness.liveAtEntry(b, v)) {
                    phis.computeIfAbsent(b, bb -> new LinkedHashMap<>()).put(v, new PhiNode(this, v, b));
                }
            }
        }
        collectDefinitions();

        // step 5
        Map<BasicBlock, Map<SourceVariable, Definition>> atEndCache = new HashMap<>();
        readsOf.forEach((v, reads) -> {
            for (Read read : reads) {
                Definition d;
                if (accesses.isTracked(v)) {
                    d = reachingBefore(read.node(), v, atEndCache);
                } else {
                    d = null;
                }
                if (d == null) {
                    d = new ImplicitUntrackedDefinition(this, v, read.node(), basicBlocks.blockOf(read.node()));
                    addDefinition(d);
                    if (accesses.isTracked(v)) {
                        LOGGER.debug("No definition of {} reaches {}", v, read.node());
                    }
                }
                reaching.put(read, d);
                readsOfDefinition.computeIfAbsent(d, dd -> new ArrayList<>()).add(read);
            }
        });
        phis.forEach((block, map) -> map.forEach((v, phi) -> {
            List<Definition> inputs = new ArrayList<>();
            for (BasicBlock pred : block.predecessors()) {
                Definition d = definitionAtEnd(pred, v, atEndCache);
                if (d != null && !inputs.contains(d)) inputs.add(d);
            }
            phiInputs.put(phi, List.copyOf(inputs));
        }));
        for (Definition d : definitions) {
            if (!d.isCertain()) {
                Definition prior = reachingBefore(d.node(), d.variable(), atEndCache);
                if (prior != null) priors.put(d, prior);
            }
        }
        for (SourceVariable v : exitVariables) {
            Definition d = reachingBefore(exit, v, atEndCache);
            if (d != null) reachingExit.put(v, d);
        }
        for (PseudoRead pr : pseudoReads) {
            Definition d = reachingBefore(pr.node, pr.variable, atEndCache);
            if (d != null) reachingPseudoReads.put(pr, d);
        }
        LOGGER.debug("SSA of {}: {} source variables, {} definitions, {} phi nodes", callable,
                accesses.sourceVariables().size(), definitions.size(), phiInputs.size());
    }

    private Map<ControlFlowNode, Map<SourceVariable, List<AssignableDefinition>>> explicitWrites() {
        Map<ControlFlowNode, Map<SourceVariable, List<AssignableDefinition>>> map = new HashMap<>();
        for (AssignableDefinition ad : accesses.writes()) {
            List<ControlFlowNode> nodes = ad.kind() == AssignableDefinition.Kind.PARAMETER
                    ? List.of(cfg.entryNode()) : cfg.nodesOf(ad.element());
            for (ControlFlowNode node : nodes) {
                map.computeIfAbsent(node, n -> new LinkedHashMap<>())
                        .computeIfAbsent(ad.variable(), v -> new ArrayList<>()).add(ad);
            }
        }
        return map;
    }

    /*
    a.f changes when a changes; processed in order of depth, so that a.b.c follows a change of a
     */
    private Map<ControlFlowNode, Set<SourceVariable>> qualifierWrites(
            Map<ControlFlowNode, Map<SourceVariable, List<AssignableDefinition>>> explicitWrites,
            Map<ControlFlowNode, Set<SourceVariable>> callWrites) {
        Map<ControlFlowNode, Set<SourceVariable>> result = new HashMap<>();
        List<SourceVariable.QualifiedFieldOrProp> qualified = accesses.tracked().stream()
                .filter(v -> v instanceof SourceVariable.QualifiedFieldOrProp)
                .map(v -> (SourceVariable.QualifiedFieldOrProp) v)
                .sorted(Comparator.comparingInt(SourceVariable::depth))
                .toList();
        for (SourceVariable.QualifiedFieldOrProp v : qualified) {
            for (ControlFlowNode node : cfg.nodes()) {
                if (node == cfg.entryNode()) continue;
                SourceVariable q = v.qualifier();
                boolean qualifierWritten = explicitWrites.getOrDefault(node, Map.of()).containsKey(q)
                                           || callWrites.getOrDefault(node, Set.of()).contains(q)
                                           || result.getOrDefault(node, Set.of()).contains(q);
                if (qualifierWritten && !explicitWrites.getOrDefault(node, Map.of()).containsKey(v)) {
                    result.computeIfAbsent(node, n -> new LinkedHashSet<>()).add(v);
                }
            }
        }
        return result;
    }

    /*
    variables that may be changed or read by code running during a call
     */
    private boolean isCallSensitive(SourceVariable v) {
        if (v.member() != null || v.isCaptured()) return true;
        return v instanceof SourceVariable.LocalScopeVariable lsv
               && !callEffects.closuresAccessing(lsv.variable()).isEmpty();
    }

    /*
    variables whose value can be observed after the callable has finished
     */
    private boolean isObservableAfterExit(SourceVariable v) {
        if (v.member() != null || v.isCaptured()) return true;
        if (v instanceof SourceVariable.LocalScopeVariable lsv) {
            if (lsv.variable() instanceof ParameterInfo pi && pi.mode().isWrittenByCallee()) return true;
            return !callEffects.closuresAccessing(lsv.variable()).isEmpty();
        }
        return false;
    }

    private void collectDefinitions() {
        for (ControlFlowNode node : cfg.nodes()) {
            BasicBlock block = basicBlocks.blockOf(node);
            if (block.firstNode() == node) {
                Map<SourceVariable, PhiNode> map = phis.get(block);
                if (map != null) {
                    map.values().forEach(this::addDefinition);
                }
            }
            Map<SourceVariable, Definition> atNode = definitionAtNode.get(node);
            if (atNode != null) {
                atNode.values().forEach(this::addDefinition);
            }
        }
    }

    private void addDefinition(Definition d) {
        definitions.add(d);
        definitionsOf.computeIfAbsent(d.variable(), v -> new ArrayList<>()).add(d);
    }

    private Definition definitionAtEnd(BasicBlock block, SourceVariable v,
                                       Map<BasicBlock, Map<SourceVariable, Definition>> cache) {
        Map<SourceVariable, Definition> map = cache.computeIfAbsent(block, b -> new HashMap<>());
        if (map.containsKey(v)) return map.get(v);
        Definition d = null;
        for (BasicBlock b = block; b != null; b = dominance.immediateDominator(b)) {
            List<Definition> list = definitionsInBlock.getOrDefault(b, Map.of()).get(v);
            if (list != null) {
                d = list.get(list.size() - 1);
                break;
            }
            PhiNode phi = phis.getOrDefault(b, Map.of()).get(v);
            if (phi != null) {
                d = phi;
                break;
            }
        }
        map.put(v, d);
        return d;
    }

    /*
    the definition reaching the node, before the definitions at the node itself
     */
    private Definition reachingBefore(ControlFlowNode node, SourceVariable v,
                                      Map<BasicBlock, Map<SourceVariable, Definition>> cache) {
        BasicBlock block = basicBlocks.blockOf(node);
        int index = basicBlocks.indexInBlock(node);
        List<Definition> list = definitionsInBlock.getOrDefault(block, Map.of()).get(v);
        if (list != null) {
            for (int i = list.size() - 1; i >= 0; i--) {
                Definition d = list.get(i);
                if (basicBlocks.indexInBlock(d.node()) < index) return d;
            }
        }
        PhiNode phi = phis.getOrDefault(block, Map.of()).get(v);
        if (phi != null) return phi;
        BasicBlock idom = dominance.immediateDominator(block);
        return idom == null ? null : definitionAtEnd(idom, v, cache);
    }

    @Override
    public Callable callable() {
        return callable;
    }

    @Override
    public ControlFlowGraph controlFlowGraph() {
        return cfg;
    }

    @Override
    public Liveness liveness() {
        return liveness;
    }

    @Override
    public Set<SourceVariable> sourceVariables() {
        return accesses.sourceVariables();
    }

    @Override
    public boolean isTracked(SourceVariable variable) {
        return accesses.isTracked(variable);
    }

    @Override
    public SourceVariable sourceVariable(String name) {
        return accesses.sourceVariables().stream().filter(v -> v.toString().equals(name)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No source variable " + name + " in " + callable));
    }

    @Override
    public List<Definition> definitions() {
        return Collections.unmodifiableList(definitions);
    }

    @Override
    public List<Definition> definitionsOf(SourceVariable variable) {
        List<Definition> list = definitionsOf.get(variable);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    @Override
    public List<Read> readsOf(SourceVariable variable) {
        List<Read> list = readsOf.get(variable);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    @Override
    public List<Read> readsAt(Element element) {
        List<Read> list = readsAt.get(element);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    @Override
    public Definition definitionReaching(Read read) {
        Definition d = reaching.get(read);
        if (d == null) throw new IllegalArgumentException("Not a read of " + callable + ": " + read);
        return d;
    }

    @Override
    public List<Read> reads(Definition definition) {
        List<Read> list = readsOfDefinition.get(definition);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    private boolean isPhiNodeOf(ControlFlowNode node, SourceVariable v) {
        BasicBlock block = basicBlocks.blockOf(node);
        return block.firstNode() == node && phis.getOrDefault(block, Map.of()).containsKey(v);
    }

    private boolean isDefinedAt(ControlFlowNode node, SourceVariable v) {
        return definitionAtNode.getOrDefault(node, Map.of()).containsKey(v);
    }

    private List<Read> readsOfAt(Definition definition, ControlFlowNode node) {
        return reads(definition).stream().filter(r -> r.node().equals(node)).toList();
    }

    /*
    the reads of the definition that are not preceded by another read of the same definition on some path
     */
    @Override
    public List<Read> firstReads(Definition definition) {
        SourceVariable v = definition.variable();
        List<Read> result = new ArrayList<>();
        Set<ControlFlowNode> visited = new HashSet<>();
        Deque<ControlFlowNode> toDo = new ArrayDeque<>();
        // a phi, and an untracked definition, share the node with their first reads
        if (definition instanceof PhiNode || definition instanceof ImplicitUntrackedDefinition) {
            visited.add(definition.node());
            toDo.add(definition.node());
        } else {
            for (ControlFlowNode s : cfg.successors(definition.node())) {
                if (visited.add(s)) toDo.add(s);
            }
        }
        while (!toDo.isEmpty()) {
            ControlFlowNode n = toDo.poll();
            if (isPhiNodeOf(n, v) && n != definition.node()) continue;
            List<Read> reads = readsOfAt(definition, n);
            if (!reads.isEmpty()) {
                result.addAll(reads);
                continue;
            }
            if (isDefinedAt(n, v)) continue;
            for (ControlFlowNode s : cfg.successors(n)) {
                if (visited.add(s)) toDo.add(s);
            }
        }
        return List.copyOf(result);
    }

    /*
    the reads of the definition after which, on some path, the definition is not read anymore
     */
    @Override
    public List<Read> lastReads(Definition definition) {
        return reads(definition).stream().filter(r -> isLastRead(definition, r)).toList();
    }

    private boolean isLastRead(Definition definition, Read read) {
        SourceVariable v = definition.variable();
        Set<ControlFlowNode> visited = new HashSet<>();
        Deque<ControlFlowNode> toDo = new ArrayDeque<>();
        List<ControlFlowNode> start = cfg.successors(read.node());
        if (start.isEmpty()) return true;
        for (ControlFlowNode s : start) {
            if (visited.add(s)) toDo.add(s);
        }
        while (!toDo.isEmpty()) {
            ControlFlowNode n = toDo.poll();
            if (isPhiNodeOf(n, v)) return true;
            if (!readsOfAt(definition, n).isEmpty()) continue;
            if (isDefinedAt(n, v)) return true;
            List<ControlFlowNode> successors = cfg.successors(n);
            if (successors.isEmpty()) return true;
            for (ControlFlowNode s : successors) {
                if (visited.add(s)) toDo.add(s);
            }
        }
        return false;
    }

    @Override
    public boolean isLiveAtEndOfBlock(Definition definition, BasicBlock block) {
        SourceVariable v = definition.variable();
        if (!accesses.isTracked(v) || !liveness.liveAtExit(block, v)) return false;
        return definitionAtEnd(block, v, new HashMap<>()) == definition;
    }

    @Override
    public Set<Definition> ultimateDefinitions(Definition definition) {
        Set<Definition> result = new LinkedHashSet<>();
        collectUltimate(definition, result, Collections.newSetFromMap(new IdentityHashMap<>()));
        return result;
    }

    private void collectUltimate(Definition d, Set<Definition> result, Set<Definition> visited) {
        if (!visited.add(d)) return;
        if (d instanceof PhiNode phi) {
            for (Definition input : inputs(phi)) collectUltimate(input, result, visited);
        } else {
            result.add(d);
            Definition prior = priors.get(d);
            if (prior != null) collectUltimate(prior, result, visited);
        }
    }

    @Override
    public Definition priorDefinition(Definition definition) {
        return priors.get(definition);
    }

    @Override
    public List<Definition> inputs(PhiNode phiNode) {
        List<Definition> list = phiInputs.get(phiNode);
        return list == null ? List.of() : list;
    }

    @Override
    public Set<LambdaInfo> flowsIntoClosure(Definition definition) {
        if (!(definition.variable() instanceof SourceVariable.LocalScopeVariable lsv) || lsv.isCaptured()) {
            return Set.of();
        }
        Set<LambdaInfo> capturing = callEffects.closuresAccessing(lsv.variable());
        if (capturing.isEmpty()) return Set.of();
        Set<LambdaInfo> result = new LinkedHashSet<>();
        Map<BasicBlock, Map<SourceVariable, Definition>> cache = new HashMap<>();
        for (Lambda lambda : accesses.lambdas()) {
            LambdaInfo li = lambda.lambdaInfo();
            if (capturing.stream().noneMatch(c -> isNestedIn(c, li))) continue;
            for (ControlFlowNode node : cfg.nodesOf(lambda)) {
                if (reachingBefore(node, lsv, cache) == definition) result.add(li);
            }
        }
        reachingPseudoReads.forEach((pr, d) -> {
            if (d == definition) {
                for (CallTarget target : pr.targets) {
                    result.addAll(callEffects.closuresReading(target, lsv.variable()));
                }
            }
        });
        return result;
    }

    private static boolean isNestedIn(Callable inner, Callable outer) {
        for (Callable c = inner; c != null; c = c.enclosingCallable()) {
            if (c == outer) return true;
        }
        return false;
    }

    @Override
    public boolean flowsOutOfClosure(Definition definition) {
        SourceVariable v = definition.variable();
        return v.isCaptured() && reachingExit.get(v) == definition;
    }

    @Override
    public String print() {
        return definitions.stream().map(d -> {
            String inputs = d instanceof PhiNode phi ? " " + inputs(phi) : "";
            List<Read> reads = reads(d);
            return d + inputs + (reads.isEmpty() ? "" : " -> " + reads.stream().map(Object::toString)
                    .collect(Collectors.joining(", ")));
        }).collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return "SSA of " + callable;
    }
}
