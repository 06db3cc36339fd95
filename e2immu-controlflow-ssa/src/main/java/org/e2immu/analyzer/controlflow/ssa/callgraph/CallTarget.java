package org.e2immu.analyzer.controlflow.ssa.callgraph;

import org.e2immu.analyzer.controlflow.common.ast.Callable;

/*
a callable that may run when a call-like element is evaluated; intra-instance when it runs on the current instance
 */
public record CallTarget(Callable callee, boolean intraInstance) {
    @Override
    public String toString() {
        return callee + (intraInstance ? " (I)" : " (X)");
    }
}
