package org.e2immu.analyzer.controlflow.common.ast;

/*
patterns are not evaluated as separate control flow nodes: matching happens at the case, arm or 'is' expression
 */
public interface Pattern {

    /*
    matches any value, so that no-match is impossible
     */
    default boolean alwaysMatches() {
        return false;
    }

    /*
    the local variable written when the pattern matches, or null
     */
    default LocalVariable binding() {
        return null;
    }
}
