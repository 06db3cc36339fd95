package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class Block implements Statement {
    private final List<Statement> statements;

    public Block(List<Statement> statements) {
        this.statements = List.copyOf(statements);
    }

    public List<Statement> statements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public List<Element> subElements() {
        return List.copyOf(statements);
    }

    @Override
    public String toString() {
        return statements.isEmpty() ? "{}" : "{...}";
    }
}
