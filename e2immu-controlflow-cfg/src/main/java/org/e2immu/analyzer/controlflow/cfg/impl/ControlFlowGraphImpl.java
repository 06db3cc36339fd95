package org.e2immu.analyzer.controlflow.cfg.impl;

import org.e2immu.analyzer.controlflow.cfg.*;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlocks;
import org.e2immu.analyzer.controlflow.cfg.dominance.Dominance;
import org.e2immu.analyzer.controlflow.common.ast.Callable;
import org.e2immu.analyzer.controlflow.common.ast.Element;

import java.util.*;
import java.util.stream.Collectors;

public class ControlFlowGraphImpl implements ControlFlowGraph {
    private final Callable callable;
    private final ElementStructure structure;
    private final List<ControlFlowNode> nodes;
    private final List<Edge> edges;
    private final Map<Element, Set<Last>> lasts;
    private final Map<Element, List<ControlFlowNode>> nodesOfElement;
    private final Map<ControlFlowNode, List<Edge>> outgoing;
    private final Map<ControlFlowNode, List<Edge>> incoming;
    private final Map<ControlFlowNode, List<ControlFlowNode>> successors;
    private final Map<ControlFlowNode, List<ControlFlowNode>> predecessors;
    private final ControlFlowNode entryNode;
    private final ControlFlowNode exitNode;
    private final ControlFlowNode normalExitNode;
    private final ControlFlowNode exceptionalExitNode;
    private final BasicBlocks basicBlocks;
    private final Dominance dominance;

    public ControlFlowGraphImpl(Callable callable,
                                ElementStructure structure,
                                List<ControlFlowNode> nodes,
                                List<Edge> edges,
                                Map<Element, Set<Last>> lasts,
                                ControlFlowNode entryNode,
                                ControlFlowNode exitNode,
                                ControlFlowNode normalExitNode,
                                ControlFlowNode exceptionalExitNode) {
        this.callable = callable;
        this.structure = structure;
        this.nodes = nodes;
        this.edges = edges;
        Map<Element, Set<Last>> lastCopy = new IdentityHashMap<>();
        lasts.forEach((e, set) -> lastCopy.put(e, Collections.unmodifiableSet(new LinkedHashSet<>(set))));
        this.lasts = lastCopy;
        this.entryNode = entryNode;
        this.exitNode = exitNode;
        this.normalExitNode = normalExitNode;
        this.exceptionalExitNode = exceptionalExitNode;

        Map<Element, List<ControlFlowNode>> byElement = new IdentityHashMap<>();
        Map<ControlFlowNode, List<Edge>> out = new HashMap<>();
        Map<ControlFlowNode, List<Edge>> in = new HashMap<>();
        for (ControlFlowNode node : nodes) {
            if (node.element() != null) {
                byElement.computeIfAbsent(node.element(), k -> new ArrayList<>()).add(node);
            }
            out.put(node, new ArrayList<>());
            in.put(node, new ArrayList<>());
        }
        for (Edge edge : edges) {
            out.get(edge.from()).add(edge);
            in.get(edge.to()).add(edge);
        }
        this.nodesOfElement = byElement;
        this.outgoing = out;
        this.incoming = in;
        Map<ControlFlowNode, List<ControlFlowNode>> succ = new HashMap<>();
        Map<ControlFlowNode, List<ControlFlowNode>> pred = new HashMap<>();
        for (ControlFlowNode node : nodes) {
            succ.put(node, out.get(node).stream().map(Edge::to).distinct().toList());
            pred.put(node, in.get(node).stream().map(Edge::from).distinct().toList());
        }
        this.successors = succ;
        this.predecessors = pred;
        this.basicBlocks = new BasicBlocks(nodes, this::successors, this::predecessors);
        this.dominance = new Dominance(basicBlocks);
    }

    @Override
    public Callable callable() {
        return callable;
    }

    @Override
    public ControlFlowNode entryNode() {
        return entryNode;
    }

    @Override
    public ControlFlowNode exitNode() {
        return exitNode;
    }

    @Override
    public ControlFlowNode normalExitNode() {
        return normalExitNode;
    }

    @Override
    public ControlFlowNode exceptionalExitNode() {
        return exceptionalExitNode;
    }

    @Override
    public List<ControlFlowNode> nodes() {
        return nodes;
    }

    @Override
    public List<ControlFlowNode> nodesOf(Element element) {
        List<ControlFlowNode> list = nodesOfElement.get(element);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    @Override
    public List<Edge> edges() {
        return edges;
    }

    @Override
    public List<Edge> outgoingEdges(ControlFlowNode node) {
        return Collections.unmodifiableList(checked(outgoing, node));
    }

    @Override
    public List<Edge> incomingEdges(ControlFlowNode node) {
        return Collections.unmodifiableList(checked(incoming, node));
    }

    @Override
    public List<ControlFlowNode> successors(ControlFlowNode node) {
        return checked(successors, node);
    }

    @Override
    public List<ControlFlowNode> successors(ControlFlowNode node, EdgeType edgeType) {
        return checked(outgoing, node).stream().filter(e -> e.type() == edgeType).map(Edge::to).distinct().toList();
    }

    @Override
    public List<ControlFlowNode> predecessors(ControlFlowNode node) {
        return checked(predecessors, node);
    }

    private static <V> V checked(Map<ControlFlowNode, V> map, ControlFlowNode node) {
        V v = map.get(node);
        if (v == null) throw new IllegalArgumentException("Node " + node + " is not part of this graph");
        return v;
    }

    @Override
    public Element first(Element element) {
        return structure.first(element);
    }

    @Override
    public Set<Last> last(Element element) {
        if (!structure.contains(element)) {
            throw new IllegalArgumentException("Element not in this callable: " + element);
        }
        Set<Last> set = lasts.get(element);
        return set == null ? Set.of() : set;
    }

    @Override
    public BasicBlocks basicBlocks() {
        return basicBlocks;
    }

    @Override
    public BasicBlock basicBlockOf(ControlFlowNode node) {
        return basicBlocks.blockOf(node);
    }

    @Override
    public Dominance dominance() {
        return dominance;
    }

    @Override
    public boolean dominates(ControlFlowNode a, ControlFlowNode b) {
        BasicBlock ba = basicBlocks.blockOf(a);
        BasicBlock bb = basicBlocks.blockOf(b);
        if (ba == bb) return basicBlocks.indexInBlock(a) <= basicBlocks.indexInBlock(b);
        return dominance.dominates(ba, bb);
    }

    @Override
    public boolean strictlyDominates(ControlFlowNode a, ControlFlowNode b) {
        return !a.equals(b) && dominates(a, b);
    }

    @Override
    public boolean postDominates(ControlFlowNode a, ControlFlowNode b) {
        BasicBlock ba = basicBlocks.blockOf(a);
        BasicBlock bb = basicBlocks.blockOf(b);
        if (ba == bb) return basicBlocks.indexInBlock(a) >= basicBlocks.indexInBlock(b);
        return dominance.postDominates(ba, bb);
    }

    @Override
    public boolean strictlyPostDominates(ControlFlowNode a, ControlFlowNode b) {
        return !a.equals(b) && postDominates(a, b);
    }

    @Override
    public String print() {
        return edges.stream().map(Edge::toString).collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return "CFG of " + callable.fullyQualifiedName();
    }
}
