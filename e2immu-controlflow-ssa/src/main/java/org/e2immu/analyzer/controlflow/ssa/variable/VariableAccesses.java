package org.e2immu.analyzer.controlflow.ssa.variable;

import org.e2immu.analyzer.controlflow.common.ast.Callable;
import org.e2immu.analyzer.controlflow.common.ast.Expression;
import org.e2immu.analyzer.controlflow.common.ast.Lambda;
import org.e2immu.analyzer.controlflow.common.ast.LocalVariable;

import java.util.List;
import java.util.Set;

/*
The result of resolving all variable accesses of one callable. The source variables are in order of first access;
the tracked ones get full SSA treatment.
 */
public record VariableAccesses(Callable callable,
                               List<ReadAccess> reads,
                               List<AssignableDefinition> writes,
                               Set<SourceVariable> sourceVariables,
                               Set<SourceVariable> tracked,
                               Set<LocalVariable> declared,
                               List<Lambda> lambdas) {

    public record ReadAccess(Expression element, SourceVariable variable) {
        @Override
        public String toString() {
            return variable + "@" + element;
        }
    }

    public boolean isTracked(SourceVariable variable) {
        return tracked.contains(variable);
    }

    public boolean isWritten(SourceVariable variable) {
        return writes.stream().anyMatch(w -> w.variable().equals(variable));
    }

    public boolean isRead(SourceVariable variable) {
        return reads.stream().anyMatch(r -> r.variable().equals(variable));
    }
}
