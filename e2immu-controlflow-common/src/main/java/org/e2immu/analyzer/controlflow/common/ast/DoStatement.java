package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class DoStatement implements LoopStatement {
    private final Statement body;
    private final Expression condition;

    public DoStatement(Statement body, Expression condition) {
        this.body = body;
        this.condition = condition;
    }

    public Expression condition() {
        return condition;
    }

    @Override
    public Statement body() {
        return body;
    }

    @Override
    public List<Element> subElements() {
        return List.of(body, condition);
    }

    @Override
    public String toString() {
        return "do ... while (" + condition + ")";
    }
}
