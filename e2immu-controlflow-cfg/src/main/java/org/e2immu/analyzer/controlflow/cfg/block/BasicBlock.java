package org.e2immu.analyzer.controlflow.cfg.block;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;

import java.util.ArrayList;
import java.util.List;

/*
Maximal sequence of nodes in which each node, except the first, has the previous one as its single predecessor,
and each node, except the last, has the next one as its single successor.
 */
public class BasicBlock {
    private final int index;
    private final List<ControlFlowNode> nodes;
    private final List<BasicBlock> successors = new ArrayList<>();
    private final List<BasicBlock> predecessors = new ArrayList<>();

    BasicBlock(int index, List<ControlFlowNode> nodes) {
        assert !nodes.isEmpty();
        this.index = index;
        this.nodes = List.copyOf(nodes);
    }

    void addSuccessor(BasicBlock successor) {
        if (!successors.contains(successor)) {
            successors.add(successor);
            successor.predecessors.add(this);
        }
    }

    public int index() {
        return index;
    }

    public List<ControlFlowNode> nodes() {
        return nodes;
    }

    public ControlFlowNode firstNode() {
        return nodes.get(0);
    }

    public ControlFlowNode lastNode() {
        return nodes.get(nodes.size() - 1);
    }

    public int size() {
        return nodes.size();
    }

    public List<BasicBlock> successors() {
        return successors;
    }

    public List<BasicBlock> predecessors() {
        return predecessors;
    }

    public boolean isEntryBlock() {
        return firstNode() instanceof ControlFlowNode.EntryNode;
    }

    public boolean isExitBlock() {
        return lastNode() instanceof ControlFlowNode.ExitNode;
    }

    public boolean isJoinBlock() {
        return predecessors.size() >= 2;
    }

    @Override
    public String toString() {
        return "B" + index;
    }
}
