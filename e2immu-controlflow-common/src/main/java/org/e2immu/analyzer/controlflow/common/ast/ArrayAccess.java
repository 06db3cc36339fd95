package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class ArrayAccess implements Expression {
    private final Expression array;
    private final Expression index;
    private final TypeInfo elementType;

    public ArrayAccess(Expression array, Expression index, TypeInfo elementType) {
        this.array = array;
        this.index = index;
        this.elementType = elementType;
    }

    public Expression array() {
        return array;
    }

    public Expression index() {
        return index;
    }

    @Override
    public TypeInfo type() {
        return elementType;
    }

    @Override
    public List<Element> subElements() {
        return List.of(array, index);
    }

    @Override
    public String toString() {
        return array + "[" + index + "]";
    }
}
