package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
read (or, as the target of an assignment, write) of a local variable or parameter
 */
public class VariableAccess implements Expression {
    private final LocalVariable variable;

    public VariableAccess(LocalVariable variable) {
        this.variable = variable;
    }

    public LocalVariable variable() {
        return variable;
    }

    @Override
    public TypeInfo type() {
        return variable.type();
    }

    @Override
    public List<Element> subElements() {
        return List.of();
    }

    @Override
    public String toString() {
        return variable.name();
    }
}
