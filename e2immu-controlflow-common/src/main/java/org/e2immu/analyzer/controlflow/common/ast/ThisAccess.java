package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class ThisAccess implements Expression {
    private final TypeInfo type;

    public ThisAccess(TypeInfo type) {
        this.type = type;
    }

    @Override
    public TypeInfo type() {
        return type;
    }

    @Override
    public List<Element> subElements() {
        return List.of();
    }

    @Override
    public String toString() {
        return "this";
    }
}
