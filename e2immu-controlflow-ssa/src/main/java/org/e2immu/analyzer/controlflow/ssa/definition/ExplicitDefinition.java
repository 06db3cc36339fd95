package org.e2immu.analyzer.controlflow.ssa.definition;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.ssa.CallableSsa;
import org.e2immu.analyzer.controlflow.ssa.variable.AssignableDefinition;

import java.util.List;

/*
A write in the source. When the same variable is written more than once at the same node, e.g. twice as an out
argument of the same call, the first one is the effective write and the definition is uncertain.
 */
public class ExplicitDefinition extends Definition {
    private final List<AssignableDefinition> assignableDefinitions;

    public ExplicitDefinition(CallableSsa ssa, ControlFlowNode node, BasicBlock block,
                              List<AssignableDefinition> assignableDefinitions) {
        super(ssa, assignableDefinitions.get(0).variable(), node, block);
        this.assignableDefinitions = List.copyOf(assignableDefinitions);
    }

    public List<AssignableDefinition> assignableDefinitions() {
        return assignableDefinitions;
    }

    public AssignableDefinition assignableDefinition() {
        return assignableDefinitions.get(0);
    }

    @Override
    public boolean isCertain() {
        return assignableDefinitions.size() == 1 && assignableDefinitions.get(0).isCertain();
    }

    @Override
    public String toString() {
        return "def " + variable + "@" + node;
    }
}
