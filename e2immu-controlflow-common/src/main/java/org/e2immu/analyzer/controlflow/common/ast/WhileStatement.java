package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class WhileStatement implements LoopStatement {
    private final Expression condition;
    private final Statement body;

    public WhileStatement(Expression condition, Statement body) {
        this.condition = condition;
        this.body = body;
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
        return List.of(condition, body);
    }

    @Override
    public String toString() {
        return "while (" + condition + ") ...";
    }
}
