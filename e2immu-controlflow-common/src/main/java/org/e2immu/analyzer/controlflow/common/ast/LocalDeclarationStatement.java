package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;
import java.util.stream.Collectors;

public class LocalDeclarationStatement implements Statement {
    private final List<LocalVariableDeclaration> declarations;

    public LocalDeclarationStatement(List<LocalVariableDeclaration> declarations) {
        this.declarations = List.copyOf(declarations);
    }

    public List<LocalVariableDeclaration> declarations() {
        return declarations;
    }

    @Override
    public List<Element> subElements() {
        return List.copyOf(declarations);
    }

    @Override
    public String toString() {
        return declarations.stream().map(Object::toString).collect(Collectors.joining(", ")) + ";";
    }
}
