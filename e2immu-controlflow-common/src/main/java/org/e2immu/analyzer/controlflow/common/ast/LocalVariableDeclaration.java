package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
declaration of a single local variable, with an optional initializer. Also used for the iteration variable of a
foreach statement, and for out-argument declarations.
 */
public class LocalVariableDeclaration implements Expression {
    private final LocalVariable variable;
    private final Expression initializer;

    public LocalVariableDeclaration(LocalVariable variable, Expression initializer) {
        this.variable = variable;
        this.initializer = initializer;
    }

    public LocalVariable variable() {
        return variable;
    }

    public Expression initializer() {
        return initializer;
    }

    @Override
    public TypeInfo type() {
        return variable.type();
    }

    @Override
    public List<Element> subElements() {
        return initializer == null ? List.of() : List.of(initializer);
    }

    @Override
    public String toString() {
        return variable.type() + " " + variable.name() + (initializer == null ? "" : " = " + initializer);
    }
}
