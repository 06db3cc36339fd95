package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class ThrowStatement implements Statement {
    private final Expression expression;

    public ThrowStatement(Expression expression) {
        this.expression = expression;
    }

    // null for a re-throw inside a catch clause
    public Expression expression() {
        return expression;
    }

    @Override
    public List<Element> subElements() {
        return expression == null ? List.of() : List.of(expression);
    }

    @Override
    public String toString() {
        return expression == null ? "throw;" : "throw " + expression + ";";
    }
}
