package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class ForEachStatement implements LoopStatement {
    private final LocalVariableDeclaration variable;
    private final Expression iterable;
    private final Statement body;

    public ForEachStatement(LocalVariableDeclaration variable, Expression iterable, Statement body) {
        assert variable.initializer() == null;
        this.variable = variable;
        this.iterable = iterable;
        this.body = body;
    }

    public LocalVariableDeclaration variable() {
        return variable;
    }

    public Expression iterable() {
        return iterable;
    }

    @Override
    public Statement body() {
        return body;
    }

    @Override
    public List<Element> subElements() {
        return List.of(iterable, variable, body);
    }

    @Override
    public String toString() {
        return "foreach (" + variable.variable() + " in " + iterable + ") ...";
    }
}
