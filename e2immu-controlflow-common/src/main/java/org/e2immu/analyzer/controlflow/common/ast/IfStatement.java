package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class IfStatement implements Statement {
    private final Expression condition;
    private final Statement thenStatement;
    private final Statement elseStatement;

    public IfStatement(Expression condition, Statement thenStatement, Statement elseStatement) {
        this.condition = condition;
        this.thenStatement = thenStatement;
        this.elseStatement = elseStatement;
    }

    public Expression condition() {
        return condition;
    }

    public Statement thenStatement() {
        return thenStatement;
    }

    // can be null
    public Statement elseStatement() {
        return elseStatement;
    }

    @Override
    public List<Element> subElements() {
        return elseStatement == null ? List.of(condition, thenStatement)
                : List.of(condition, thenStatement, elseStatement);
    }

    @Override
    public String toString() {
        return "if (" + condition + ") ..." + (elseStatement == null ? "" : " else ...");
    }
}
