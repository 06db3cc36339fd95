package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class ExpressionStatement implements Statement {
    private final Expression expression;

    public ExpressionStatement(Expression expression) {
        this.expression = expression;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public List<Element> subElements() {
        return List.of(expression);
    }

    @Override
    public String toString() {
        return expression + ";";
    }
}
