package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
a type used as the qualifier of a static member; never evaluated
 */
public class TypeAccess implements Expression {
    private final TypeInfo type;

    public TypeAccess(TypeInfo type) {
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
        return type.name();
    }
}
