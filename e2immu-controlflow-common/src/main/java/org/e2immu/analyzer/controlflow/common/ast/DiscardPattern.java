package org.e2immu.analyzer.controlflow.common.ast;

public record DiscardPattern() implements Pattern {

    @Override
    public boolean alwaysMatches() {
        return true;
    }

    @Override
    public String toString() {
        return "_";
    }
}
