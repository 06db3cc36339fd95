package org.e2immu.analyzer.controlflow.ssa.definition;

import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.ssa.CallableSsa;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;

import java.util.List;

/*
merges the definitions reaching a join block along its incoming edges
 */
public class PhiNode extends Definition {

    public PhiNode(CallableSsa ssa, SourceVariable variable, BasicBlock block) {
        super(ssa, variable, block.firstNode(), block);
    }

    /*
    the distinct definitions at the end of the predecessor blocks
     */
    public List<Definition> inputs() {
        return ssa.inputs(this);
    }

    @Override
    public boolean isPseudo() {
        return true;
    }

    @Override
    public String toString() {
        return "phi " + variable + "@" + block;
    }
}
