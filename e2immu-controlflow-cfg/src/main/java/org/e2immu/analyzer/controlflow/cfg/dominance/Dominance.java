package org.e2immu.analyzer.controlflow.cfg.dominance;

import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlocks;

import java.util.*;
import java.util.function.Function;

/*
Dominator and post-dominator trees over the basic blocks, and dominance frontiers.

Immediate dominators are computed with the iterative algorithm of Cooper, Harvey and Kennedy, over the reverse
post-order of the blocks. Post-dominators use the same algorithm on the reversed graph, starting from the exit
block; blocks from which the exit cannot be reached have no post-dominator.
 */
public class Dominance {
    private final BasicBlocks basicBlocks;
    private final BasicBlock[] immediateDominators;
    private final BasicBlock[] immediatePostDominators;
    private final List<List<BasicBlock>> dominatorTreeChildren;
    private final List<Set<BasicBlock>> frontiers;

    public Dominance(BasicBlocks basicBlocks) {
        this.basicBlocks = basicBlocks;
        int n = basicBlocks.blocks().size();
        immediateDominators = computeImmediateDominators(n, basicBlocks.entryBlock(), BasicBlock::successors,
                BasicBlock::predecessors);
        BasicBlock exit = basicBlocks.exitBlock();
        immediatePostDominators = exit == null ? new BasicBlock[n]
                : computeImmediateDominators(n, exit, BasicBlock::predecessors, BasicBlock::successors);

        List<List<BasicBlock>> children = new ArrayList<>(n);
        for (int i = 0; i < n; i++) children.add(new ArrayList<>());
        for (BasicBlock block : basicBlocks.blocks()) {
            BasicBlock idom = immediateDominators[block.index()];
            if (idom != null && idom != block) children.get(idom.index()).add(block);
        }
        this.dominatorTreeChildren = children.stream().map(List::copyOf).toList();

        List<Set<BasicBlock>> df = new ArrayList<>(n);
        for (int i = 0; i < n; i++) df.add(new LinkedHashSet<>());
        for (BasicBlock block : basicBlocks.blocks()) {
            if (block.predecessors().size() >= 2) {
                BasicBlock idom = immediateDominators[block.index()];
                for (BasicBlock pred : block.predecessors()) {
                    BasicBlock runner = pred;
                    while (runner != null && runner != idom) {
                        df.get(runner.index()).add(block);
                        runner = immediateDominators[runner.index()] == runner ? null
                                : immediateDominators[runner.index()];
                    }
                }
            }
        }
        this.frontiers = df.stream().map(s -> Collections.unmodifiableSet(new LinkedHashSet<>(s))).toList();
    }

    private static BasicBlock[] computeImmediateDominators(int n,
                                                           BasicBlock root,
                                                           Function<BasicBlock, List<BasicBlock>> successors,
                                                           Function<BasicBlock, List<BasicBlock>> predecessors) {
        // post-order numbering, iterative depth-first search
        int[] postOrder = new int[n];
        Arrays.fill(postOrder, -1);
        List<BasicBlock> order = new ArrayList<>(n);
        boolean[] visited = new boolean[n];
        Deque<Iterator<BasicBlock>> iterators = new ArrayDeque<>();
        Deque<BasicBlock> stack = new ArrayDeque<>();
        visited[root.index()] = true;
        stack.push(root);
        iterators.push(successors.apply(root).iterator());
        while (!stack.isEmpty()) {
            Iterator<BasicBlock> iterator = iterators.peek();
            if (iterator.hasNext()) {
                BasicBlock next = iterator.next();
                if (!visited[next.index()]) {
                    visited[next.index()] = true;
                    stack.push(next);
                    iterators.push(successors.apply(next).iterator());
                }
            } else {
                BasicBlock done = stack.pop();
                iterators.pop();
                postOrder[done.index()] = order.size();
                order.add(done);
            }
        }

        BasicBlock[] idom = new BasicBlock[n];
        idom[root.index()] = root;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = order.size() - 2; i >= 0; i--) {
                BasicBlock block = order.get(i);
                BasicBlock newIdom = null;
                for (BasicBlock pred : predecessors.apply(block)) {
                    if (postOrder[pred.index()] < 0 || idom[pred.index()] == null) continue;
                    newIdom = newIdom == null ? pred : intersect(pred, newIdom, idom, postOrder);
                }
                if (newIdom != null && idom[block.index()] != newIdom) {
                    idom[block.index()] = newIdom;
                    changed = true;
                }
            }
        }
        return idom;
    }

    private static BasicBlock intersect(BasicBlock b1, BasicBlock b2, BasicBlock[] idom, int[] postOrder) {
        BasicBlock finger1 = b1;
        BasicBlock finger2 = b2;
        while (finger1 != finger2) {
            while (postOrder[finger1.index()] < postOrder[finger2.index()]) finger1 = idom[finger1.index()];
            while (postOrder[finger2.index()] < postOrder[finger1.index()]) finger2 = idom[finger2.index()];
        }
        return finger1;
    }

    public BasicBlocks basicBlocks() {
        return basicBlocks;
    }

    /*
    null for the entry block
     */
    public BasicBlock immediateDominator(BasicBlock block) {
        BasicBlock idom = immediateDominators[block.index()];
        return idom == block ? null : idom;
    }

    /*
    null for the exit block, and for blocks that cannot reach the exit
     */
    public BasicBlock immediatePostDominator(BasicBlock block) {
        BasicBlock ipdom = immediatePostDominators[block.index()];
        return ipdom == block ? null : ipdom;
    }

    public List<BasicBlock> dominatorTreeChildren(BasicBlock block) {
        return dominatorTreeChildren.get(block.index());
    }

    public boolean dominates(BasicBlock a, BasicBlock b) {
        return isAncestor(a, b, immediateDominators);
    }

    public boolean strictlyDominates(BasicBlock a, BasicBlock b) {
        return a != b && dominates(a, b);
    }

    public boolean postDominates(BasicBlock a, BasicBlock b) {
        return isAncestor(a, b, immediatePostDominators);
    }

    public boolean strictlyPostDominates(BasicBlock a, BasicBlock b) {
        return a != b && postDominates(a, b);
    }

    private static boolean isAncestor(BasicBlock a, BasicBlock b, BasicBlock[] tree) {
        BasicBlock current = b;
        while (current != null) {
            if (current == a) return true;
            BasicBlock parent = tree[current.index()];
            current = parent == current ? null : parent;
        }
        return false;
    }

    public Set<BasicBlock> dominanceFrontier(BasicBlock block) {
        return frontiers.get(block.index());
    }

    /*
    the limit of repeatedly taking the dominance frontier of the set and its frontier; used for phi placement
     */
    public Set<BasicBlock> iteratedDominanceFrontier(Collection<BasicBlock> blocks) {
        Set<BasicBlock> result = new TreeSet<>(Comparator.comparingInt(BasicBlock::index));
        Deque<BasicBlock> toDo = new ArrayDeque<>(blocks);
        Set<BasicBlock> seen = new HashSet<>(blocks);
        while (!toDo.isEmpty()) {
            BasicBlock block = toDo.poll();
            for (BasicBlock frontier : dominanceFrontier(block)) {
                if (result.add(frontier) && seen.add(frontier)) {
                    toDo.add(frontier);
                }
            }
        }
        return result;
    }
}
