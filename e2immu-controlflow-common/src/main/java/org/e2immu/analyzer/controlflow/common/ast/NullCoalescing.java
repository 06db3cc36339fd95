package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
lhs ?? rhs: rhs is only evaluated when lhs is null
 */
public class NullCoalescing implements Expression {
    private final Expression lhs;
    private final Expression rhs;

    public NullCoalescing(Expression lhs, Expression rhs) {
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public Expression lhs() {
        return lhs;
    }

    public Expression rhs() {
        return rhs;
    }

    @Override
    public TypeInfo type() {
        return lhs.type();
    }

    @Override
    public List<Element> subElements() {
        return List.of(lhs, rhs);
    }

    @Override
    public String toString() {
        return lhs + " ?? " + rhs;
    }
}
