package org.e2immu.analyzer.controlflow.ssa.definition;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.e2immu.analyzer.controlflow.common.ast.Element;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;

/*
a read of a source variable at a node; the element is the access expression
 */
public record Read(ControlFlowNode node, SourceVariable variable, Element element) {
    @Override
    public String toString() {
        return variable + "@" + node;
    }
}
