package org.e2immu.analyzer.controlflow.ssa.definition;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.ssa.CallableSsa;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;

/*
value held by a field, property or captured variable when the callable starts
 */
public class ImplicitEntryDefinition extends Definition {

    public ImplicitEntryDefinition(CallableSsa ssa, SourceVariable variable, ControlFlowNode node, BasicBlock block) {
        super(ssa, variable, node, block);
    }

    @Override
    public boolean isPseudo() {
        return true;
    }

    @Override
    public String toString() {
        return "entry " + variable;
    }
}
