package org.e2immu.analyzer.controlflow.ssa.definition;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.common.ast.LambdaInfo;
import org.e2immu.analyzer.controlflow.ssa.CallableSsa;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;

import java.util.List;
import java.util.Set;

/*
A point where a source variable receives a value, explicitly or implicitly. Identity is reference identity.
The queries delegate to the SSA form that created the definition.
 */
public abstract class Definition {
    protected final CallableSsa ssa;
    protected final SourceVariable variable;
    protected final ControlFlowNode node;
    protected final BasicBlock block;

    protected Definition(CallableSsa ssa, SourceVariable variable, ControlFlowNode node, BasicBlock block) {
        this.ssa = ssa;
        this.variable = variable;
        this.node = node;
        this.block = block;
    }

    public SourceVariable variable() {
        return variable;
    }

    /*
    for a phi node, the first node of its block
     */
    public ControlFlowNode node() {
        return node;
    }

    public BasicBlock block() {
        return block;
    }

    /*
    an uncertain definition may leave the variable unchanged; its prior definition then still holds
     */
    public boolean isCertain() {
        return true;
    }

    /*
    phi nodes, and implicit definitions that do not correspond to a write in the source
     */
    public boolean isPseudo() {
        return false;
    }

    public List<Read> reads() {
        return ssa.reads(this);
    }

    public List<Read> firstReads() {
        return ssa.firstReads(this);
    }

    public List<Read> lastReads() {
        return ssa.lastReads(this);
    }

    public boolean isLiveAtEndOfBlock(BasicBlock b) {
        return ssa.isLiveAtEndOfBlock(this, b);
    }

    public Set<Definition> ultimateDefinitions() {
        return ssa.ultimateDefinitions(this);
    }

    /*
    the definition reaching this one, for uncertain definitions; null otherwise
     */
    public Definition priorDefinition() {
        return ssa.priorDefinition(this);
    }

    public Set<LambdaInfo> flowsIntoClosure() {
        return ssa.flowsIntoClosure(this);
    }

    public boolean flowsOutOfClosure() {
        return ssa.flowsOutOfClosure(this);
    }
}
