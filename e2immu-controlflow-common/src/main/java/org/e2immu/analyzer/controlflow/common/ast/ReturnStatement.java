package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class ReturnStatement implements Statement {
    private final Expression expression;

    public ReturnStatement(Expression expression) {
        this.expression = expression;
    }

    // null in a void method
    public Expression expression() {
        return expression;
    }

    @Override
    public List<Element> subElements() {
        return expression == null ? List.of() : List.of(expression);
    }

    @Override
    public String toString() {
        return expression == null ? "return;" : "return " + expression + ";";
    }
}
