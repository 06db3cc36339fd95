package org.e2immu.analyzer.controlflow.ssa.definition;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.ssa.CallableSsa;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;

/*
a qualified field a.f is redefined when its qualifier a receives a new value
 */
public class ImplicitQualifierDefinition extends Definition {

    public ImplicitQualifierDefinition(CallableSsa ssa, SourceVariable variable, ControlFlowNode node, BasicBlock block) {
        super(ssa, variable, node, block);
    }

    @Override
    public boolean isPseudo() {
        return true;
    }

    @Override
    public String toString() {
        return "qualifier " + variable + "@" + node;
    }
}
