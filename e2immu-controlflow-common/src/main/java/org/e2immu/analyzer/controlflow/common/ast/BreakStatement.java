package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class BreakStatement implements Statement {

    @Override
    public List<Element> subElements() {
        return List.of();
    }

    @Override
    public String toString() {
        return "break;";
    }
}
