package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class LabeledStatement implements Statement {
    private final String label;
    private final Statement statement;

    public LabeledStatement(String label, Statement statement) {
        this.label = label;
        this.statement = statement;
    }

    public String label() {
        return label;
    }

    public Statement statement() {
        return statement;
    }

    @Override
    public List<Element> subElements() {
        return List.of(statement);
    }

    @Override
    public String toString() {
        return label + ":";
    }
}
