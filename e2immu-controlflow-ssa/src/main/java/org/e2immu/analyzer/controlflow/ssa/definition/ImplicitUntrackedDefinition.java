package org.e2immu.analyzer.controlflow.ssa.definition;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.ssa.CallableSsa;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;

/*
the value of an untracked variable, as observed at one read
 */
public class ImplicitUntrackedDefinition extends Definition {

    public ImplicitUntrackedDefinition(CallableSsa ssa, SourceVariable variable, ControlFlowNode node, BasicBlock block) {
        super(ssa, variable, node, block);
    }

    @Override
    public boolean isPseudo() {
        return true;
    }

    @Override
    public String toString() {
        return "untracked " + variable + "@" + node;
    }
}
