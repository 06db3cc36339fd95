package org.e2immu.analyzer.controlflow.cfg.block;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/*
Partition of the nodes of a control flow graph into basic blocks.

A node starts a new block when it is the entry node, when it does not have exactly one predecessor, or when its
single predecessor has more than one successor. Blocks are numbered in the order of their first node.
 */
public class BasicBlocks {
    private static final Logger LOGGER = LoggerFactory.getLogger(BasicBlocks.class);

    private final List<BasicBlock> blocks;
    private final Map<ControlFlowNode, BasicBlock> blockOfNode;
    private final Map<ControlFlowNode, Integer> indexInBlock;
    private final BasicBlock entryBlock;
    private final BasicBlock exitBlock;

    /*
    nodes in a deterministic order, starting with the entry node; successors and predecessors as distinct nodes
     */
    public BasicBlocks(List<ControlFlowNode> nodes,
                       Function<ControlFlowNode, List<ControlFlowNode>> successors,
                       Function<ControlFlowNode, List<ControlFlowNode>> predecessors) {
        Set<ControlFlowNode> leaders = new HashSet<>();
        for (ControlFlowNode node : nodes) {
            List<ControlFlowNode> preds = predecessors.apply(node);
            if (node instanceof ControlFlowNode.EntryNode || preds.size() != 1
                || successors.apply(preds.get(0)).size() != 1
                || preds.get(0) == node) {
                leaders.add(node);
            }
        }
        List<BasicBlock> list = new ArrayList<>();
        Map<ControlFlowNode, BasicBlock> map = new HashMap<>();
        Map<ControlFlowNode, Integer> indexMap = new HashMap<>();
        for (ControlFlowNode node : nodes) {
            if (!leaders.contains(node)) continue;
            List<ControlFlowNode> blockNodes = new ArrayList<>();
            ControlFlowNode current = node;
            while (true) {
                indexMap.put(current, blockNodes.size());
                blockNodes.add(current);
                List<ControlFlowNode> succ = successors.apply(current);
                if (succ.size() != 1 || leaders.contains(succ.get(0))) break;
                current = succ.get(0);
            }
            BasicBlock block = new BasicBlock(list.size(), blockNodes);
            list.add(block);
            blockNodes.forEach(n -> map.put(n, block));
        }
        for (BasicBlock block : list) {
            for (ControlFlowNode succ : successors.apply(block.lastNode())) {
                block.addSuccessor(map.get(succ));
            }
        }
        this.blocks = List.copyOf(list);
        this.blockOfNode = Map.copyOf(map);
        this.indexInBlock = Map.copyOf(indexMap);
        this.entryBlock = list.get(0);
        this.exitBlock = list.stream().filter(BasicBlock::isExitBlock).findFirst().orElse(null);
        LOGGER.debug("Computed {} basic blocks for {} nodes", blocks.size(), nodes.size());
    }

    public List<BasicBlock> blocks() {
        return blocks;
    }

    public BasicBlock entryBlock() {
        return entryBlock;
    }

    /*
    null when the exit of the callable cannot be reached
     */
    public BasicBlock exitBlock() {
        return exitBlock;
    }

    public BasicBlock blockOf(ControlFlowNode node) {
        BasicBlock block = blockOfNode.get(node);
        if (block == null) throw new IllegalArgumentException("Node " + node + " is not part of this graph");
        return block;
    }

    public int indexInBlock(ControlFlowNode node) {
        Integer index = indexInBlock.get(node);
        if (index == null) throw new IllegalArgumentException("Node " + node + " is not part of this graph");
        return index;
    }

    /*
    one line per block: index, nodes, successors
     */
    public String print() {
        return blocks.stream().map(b -> b + ": "
                                        + b.nodes().stream().map(Object::toString).collect(Collectors.joining("; "))
                                        + (b.successors().isEmpty() ? "" : " -> " + b.successors().stream()
                        .map(Object::toString).collect(Collectors.joining(", "))))
                .collect(Collectors.joining("\n"));
    }
}
