package org.e2immu.analyzer.controlflow.cfg.split;

import org.e2immu.analyzer.controlflow.common.ast.TypeInfo;

/*
Active while the catch clauses of a try statement are being matched against an exception of the given type.
 */
public record ExceptionHandlerSplit(TypeInfo exceptionType) implements Split {

    public static final int RANK = Integer.MAX_VALUE;

    @Override
    public int rank() {
        return RANK;
    }

    @Override
    public String toString() {
        return "eh:" + exceptionType;
    }
}
