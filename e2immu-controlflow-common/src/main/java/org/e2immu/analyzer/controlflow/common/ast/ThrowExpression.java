package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class ThrowExpression implements Expression {
    private final Expression exception;

    public ThrowExpression(Expression exception) {
        this.exception = exception;
    }

    public Expression exception() {
        return exception;
    }

    @Override
    public TypeInfo type() {
        return exception.type();
    }

    @Override
    public List<Element> subElements() {
        return List.of(exception);
    }

    @Override
    public String toString() {
        return "throw " + exception;
    }
}
