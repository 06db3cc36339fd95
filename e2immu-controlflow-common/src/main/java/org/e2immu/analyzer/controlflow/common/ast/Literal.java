package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class Literal implements Expression {
    private final Object value;
    private final TypeInfo type;

    public Literal(Object value, TypeInfo type) {
        this.value = value;
        this.type = type;
    }

    @Override
    public TypeInfo type() {
        return type;
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public Object constantValue() {
        return value;
    }

    @Override
    public List<Element> subElements() {
        return List.of();
    }

    @Override
    public String toString() {
        return value instanceof String s ? "\"" + s + "\"" : String.valueOf(value);
    }
}
