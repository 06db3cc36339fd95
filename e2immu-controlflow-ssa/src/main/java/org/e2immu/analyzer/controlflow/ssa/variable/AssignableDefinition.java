package org.e2immu.analyzer.controlflow.ssa.variable;

import org.e2immu.analyzer.controlflow.common.ast.Element;

/*
A write to a source variable in the syntax tree. The element is the one at whose control flow node the write
takes place; it is null for parameters, which are written at the entry node.
 */
public record AssignableDefinition(Kind kind, SourceVariable variable, Element element) {

    public enum Kind {
        ASSIGNMENT, DECLARATION, PARAMETER, OUT_ARGUMENT, REF_ARGUMENT, PATTERN, FOREACH, CATCH
    }

    /*
    the callee may leave a ref argument untouched
     */
    public boolean isCertain() {
        return kind != Kind.REF_ARGUMENT;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + variable;
    }
}
