package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;

public class ForStatement implements LoopStatement {
    private final List<Expression> initializers;
    private final Expression condition;
    private final List<Expression> updaters;
    private final Statement body;

    public ForStatement(List<Expression> initializers, Expression condition, List<Expression> updaters,
                        Statement body) {
        this.initializers = List.copyOf(initializers);
        this.condition = condition;
        this.updaters = List.copyOf(updaters);
        this.body = body;
    }

    public List<Expression> initializers() {
        return initializers;
    }

    // null when absent, i.e., an infinite loop
    public Expression condition() {
        return condition;
    }

    public List<Expression> updaters() {
        return updaters;
    }

    @Override
    public Statement body() {
        return body;
    }

    @Override
    public List<Element> subElements() {
        List<Element> list = new ArrayList<>(initializers);
        if (condition != null) list.add(condition);
        list.addAll(updaters);
        list.add(body);
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        return "for (...; " + (condition == null ? "" : condition) + "; ...) ...";
    }
}
