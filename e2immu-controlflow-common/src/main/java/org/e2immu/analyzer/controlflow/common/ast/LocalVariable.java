package org.e2immu.analyzer.controlflow.common.ast;

public class LocalVariable {
    private final String name;
    private final TypeInfo type;

    public LocalVariable(String name, TypeInfo type) {
        this.name = name;
        this.type = type;
    }

    public String name() {
        return name;
    }

    public TypeInfo type() {
        return type;
    }

    public boolean isParameter() {
        return false;
    }

    @Override
    public String toString() {
        return name;
    }
}
