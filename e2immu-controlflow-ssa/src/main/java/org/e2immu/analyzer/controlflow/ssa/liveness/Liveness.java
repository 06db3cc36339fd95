package org.e2immu.analyzer.controlflow.ssa.liveness;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlocks;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
Backward live-variable analysis on basic blocks.

A variable is live at a point when some path from that point reaches a read of the variable without passing a
certain write. Uncertain writes neither kill nor generate. Within a node, reads happen before writes.
 */
public class Liveness {
    private static final Logger LOGGER = LoggerFactory.getLogger(Liveness.class);

    public enum Kind {READ, CERTAIN_WRITE, UNCERTAIN_WRITE}

    public record Reference(ControlFlowNode node, SourceVariable variable, Kind kind) {
        @Override
        public String toString() {
            return kind.name().toLowerCase() + " " + variable + "@" + node;
        }
    }

    private final BasicBlocks basicBlocks;
    private final Map<BasicBlock, Map<SourceVariable, List<Reference>>> referencesPerBlock = new HashMap<>();
    private final Map<BasicBlock, Set<SourceVariable>> liveIn = new HashMap<>();
    private final Map<BasicBlock, Set<SourceVariable>> liveOut = new HashMap<>();

    public Liveness(BasicBlocks basicBlocks, Collection<Reference> references) {
        this.basicBlocks = basicBlocks;
        Comparator<Reference> order = Comparator
                .comparingInt((Reference r) -> basicBlocks.indexInBlock(r.node()))
                .thenComparing(Reference::kind);
        for (Reference reference : references) {
            BasicBlock block = basicBlocks.blockOf(reference.node());
            referencesPerBlock.computeIfAbsent(block, b -> new HashMap<>())
                    .computeIfAbsent(reference.variable(), v -> new ArrayList<>())
                    .add(reference);
        }
        referencesPerBlock.values().forEach(map -> map.values().forEach(list -> list.sort(order)));
        compute();
    }

    private void compute() {
        Map<BasicBlock, Set<SourceVariable>> use = new HashMap<>();
        Map<BasicBlock, Set<SourceVariable>> def = new HashMap<>();
        for (BasicBlock block : basicBlocks.blocks()) {
            Set<SourceVariable> u = new HashSet<>();
            Set<SourceVariable> d = new HashSet<>();
            referencesPerBlock.getOrDefault(block, Map.of()).forEach((v, list) -> {
                for (Reference r : list) {
                    if (r.kind() == Kind.READ) {
                        u.add(v);
                        break;
                    }
                    if (r.kind() == Kind.CERTAIN_WRITE) {
                        d.add(v);
                        break;
                    }
                }
            });
            use.put(block, u);
            def.put(block, d);
            liveIn.put(block, new HashSet<>(u));
            liveOut.put(block, new HashSet<>());
        }
        List<BasicBlock> reversed = new ArrayList<>(basicBlocks.blocks());
        Collections.reverse(reversed);
        boolean changed = true;
        int iterations = 0;
        while (changed) {
            changed = false;
            iterations++;
            for (BasicBlock block : reversed) {
                Set<SourceVariable> out = liveOut.get(block);
                for (BasicBlock successor : block.successors()) {
                    out.addAll(liveIn.get(successor));
                }
                Set<SourceVariable> in = liveIn.get(block);
                Set<SourceVariable> d = def.get(block);
                for (SourceVariable v : out) {
                    if (!d.contains(v) && in.add(v)) changed = true;
                }
            }
        }
        LOGGER.debug("Liveness converged after {} iterations over {} blocks", iterations,
                basicBlocks.blocks().size());
    }

    public BasicBlocks basicBlocks() {
        return basicBlocks;
    }

    public boolean liveAtEntry(BasicBlock block, SourceVariable variable) {
        return liveIn.get(block).contains(variable);
    }

    public boolean liveAtExit(BasicBlock block, SourceVariable variable) {
        return liveOut.get(block).contains(variable);
    }

    /*
    live immediately after all references at the node have been processed
     */
    public boolean liveAfter(ControlFlowNode node, SourceVariable variable) {
        BasicBlock block = basicBlocks.blockOf(node);
        int index = basicBlocks.indexInBlock(node);
        List<Reference> list = referencesPerBlock.getOrDefault(block, Map.of()).getOrDefault(variable, List.of());
        for (Reference r : list) {
            if (basicBlocks.indexInBlock(r.node()) <= index) continue;
            if (r.kind() == Kind.READ) return true;
            if (r.kind() == Kind.CERTAIN_WRITE) return false;
        }
        return liveAtExit(block, variable);
    }

    /*
    live before any of the references at the node
     */
    public boolean liveBefore(ControlFlowNode node, SourceVariable variable) {
        BasicBlock block = basicBlocks.blockOf(node);
        int index = basicBlocks.indexInBlock(node);
        List<Reference> list = referencesPerBlock.getOrDefault(block, Map.of()).getOrDefault(variable, List.of());
        for (Reference r : list) {
            if (basicBlocks.indexInBlock(r.node()) < index) continue;
            if (r.kind() == Kind.READ) return true;
            if (r.kind() == Kind.CERTAIN_WRITE) return false;
        }
        return liveAtExit(block, variable);
    }

    /*
    the references of the variable in the block, in evaluation order
     */
    public List<Reference> references(BasicBlock block, SourceVariable variable) {
        return Collections.unmodifiableList(referencesPerBlock.getOrDefault(block, Map.of())
                .getOrDefault(variable, List.of()));
    }
}
