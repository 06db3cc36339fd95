package org.e2immu.analyzer.controlflow.common.ast;

public record TypePattern(TypeInfo type, LocalVariable binding) implements Pattern {

    @Override
    public String toString() {
        return type + (binding == null ? "" : " " + binding);
    }
}
