package org.e2immu.analyzer.controlflow.common.ast;

public class ParameterInfo extends LocalVariable {
    private final int index;
    private final ParameterMode mode;

    public ParameterInfo(String name, TypeInfo type, int index, ParameterMode mode) {
        super(name, type);
        this.index = index;
        this.mode = mode;
    }

    public int index() {
        return index;
    }

    public ParameterMode mode() {
        return mode;
    }

    @Override
    public boolean isParameter() {
        return true;
    }
}
