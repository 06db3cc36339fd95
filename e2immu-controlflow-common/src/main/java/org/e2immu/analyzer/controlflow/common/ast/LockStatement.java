package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class LockStatement implements Statement {
    private final Expression lock;
    private final Statement body;

    public LockStatement(Expression lock, Statement body) {
        this.lock = lock;
        this.body = body;
    }

    public Expression lock() {
        return lock;
    }

    public Statement body() {
        return body;
    }

    @Override
    public List<Element> subElements() {
        return List.of(lock, body);
    }

    @Override
    public String toString() {
        return "lock (" + lock + ") ...";
    }
}
