package org.e2immu.analyzer.controlflow.common.ast;

public enum ParameterMode {
    VALUE, REF, OUT, IN;

    public boolean isWrittenByCallee() {
        return this == REF || this == OUT;
    }

    public boolean isReadBeforeCall() {
        return this != OUT;
    }
}
