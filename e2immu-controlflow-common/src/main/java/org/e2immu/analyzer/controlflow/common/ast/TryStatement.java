package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;

public class TryStatement implements Statement {
    private final Block block;
    private final List<CatchClause> catchClauses;
    private final Block finallyBlock;

    public TryStatement(Block block, List<CatchClause> catchClauses, Block finallyBlock) {
        this.block = block;
        this.catchClauses = List.copyOf(catchClauses);
        this.finallyBlock = finallyBlock;
    }

    public Block block() {
        return block;
    }

    public List<CatchClause> catchClauses() {
        return catchClauses;
    }

    // null when absent
    public Block finallyBlock() {
        return finallyBlock;
    }

    @Override
    public List<Element> subElements() {
        List<Element> list = new ArrayList<>(catchClauses.size() + 2);
        list.add(block);
        list.addAll(catchClauses);
        if (finallyBlock != null) list.add(finallyBlock);
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        return "try ...";
    }
}
