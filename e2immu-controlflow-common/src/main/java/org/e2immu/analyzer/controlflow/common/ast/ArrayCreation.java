package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;

public class ArrayCreation implements Expression {
    private final TypeInfo arrayType;
    private final List<Expression> dimensions;
    private final List<Expression> initializers;

    public ArrayCreation(TypeInfo arrayType, List<Expression> dimensions, List<Expression> initializers) {
        this.arrayType = arrayType;
        this.dimensions = List.copyOf(dimensions);
        this.initializers = List.copyOf(initializers);
    }

    public List<Expression> dimensions() {
        return dimensions;
    }

    public List<Expression> initializers() {
        return initializers;
    }

    @Override
    public TypeInfo type() {
        return arrayType;
    }

    @Override
    public List<Element> subElements() {
        List<Element> list = new ArrayList<>(dimensions);
        list.addAll(initializers);
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        return "new " + arrayType + "[" + (dimensions.isEmpty() ? "" : dimensions.get(0)) + "]"
               + (initializers.isEmpty() ? "" : " {...}");
    }
}
