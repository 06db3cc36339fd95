package org.e2immu.analyzer.controlflow.cfg;

import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlocks;
import org.e2immu.analyzer.controlflow.cfg.dominance.Dominance;
import org.e2immu.analyzer.controlflow.common.ast.Callable;
import org.e2immu.analyzer.controlflow.common.ast.Element;

import java.util.List;
import java.util.Set;

/*
The control flow graph of one callable. Only nodes reachable from the entry node exist.
Immutable once built.
 */
public interface ControlFlowGraph {

    Callable callable();

    ControlFlowNode entryNode();

    /*
    null when the callable cannot complete, e.g., because of an infinite loop
     */
    ControlFlowNode exitNode();

    /*
    reached by normal completion and return; null when not reachable
     */
    ControlFlowNode normalExitNode();

    /*
    reached by exceptions that leave the callable; null when not reachable
     */
    ControlFlowNode exceptionalExitNode();

    /*
    in order of discovery, starting with the entry node
     */
    List<ControlFlowNode> nodes();

    /*
    all nodes of the element, one per distinct set of splits; empty when the element is not reachable
     */
    List<ControlFlowNode> nodesOf(Element element);

    List<Edge> edges();

    List<Edge> outgoingEdges(ControlFlowNode node);

    List<Edge> incomingEdges(ControlFlowNode node);

    /*
    distinct successor nodes
     */
    List<ControlFlowNode> successors(ControlFlowNode node);

    List<ControlFlowNode> successors(ControlFlowNode node, EdgeType edgeType);

    /*
    distinct predecessor nodes
     */
    List<ControlFlowNode> predecessors(ControlFlowNode node);

    /*
    the first sub-element evaluated when the element starts executing
     */
    Element first(Element element);

    /*
    the sub-elements at which the element can finish, with the completion of the element; only completions
    observed on reachable nodes are present
     */
    Set<Last> last(Element element);

    BasicBlocks basicBlocks();

    BasicBlock basicBlockOf(ControlFlowNode node);

    Dominance dominance();

    boolean dominates(ControlFlowNode a, ControlFlowNode b);

    boolean strictlyDominates(ControlFlowNode a, ControlFlowNode b);

    boolean postDominates(ControlFlowNode a, ControlFlowNode b);

    boolean strictlyPostDominates(ControlFlowNode a, ControlFlowNode b);

    /*
    one edge per line, in node order
     */
    String print();
}
