package org.e2immu.analyzer.controlflow.ssa.definition;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.ssa.CallableSsa;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;

/*
the variable may be changed by a call: a field by a setter, a captured variable by a closure
 */
public class ImplicitCallDefinition extends Definition {

    public ImplicitCallDefinition(CallableSsa ssa, SourceVariable variable, ControlFlowNode node, BasicBlock block) {
        super(ssa, variable, node, block);
    }

    @Override
    public boolean isCertain() {
        return false;
    }

    @Override
    public boolean isPseudo() {
        return true;
    }

    @Override
    public String toString() {
        return "call " + variable + "@" + node;
    }
}
