package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class LogicalAnd implements Expression {
    private final Expression lhs;
    private final Expression rhs;
    private final TypeInfo boolType;

    public LogicalAnd(Expression lhs, Expression rhs, TypeInfo boolType) {
        this.lhs = lhs;
        this.rhs = rhs;
        this.boolType = boolType;
    }

    public Expression lhs() {
        return lhs;
    }

    public Expression rhs() {
        return rhs;
    }

    @Override
    public TypeInfo type() {
        return boolType;
    }

    @Override
    public boolean isConstant() {
        return lhs.isConstant() && rhs.isConstant();
    }

    @Override
    public Object constantValue() {
        return Boolean.TRUE.equals(lhs.constantValue()) && Boolean.TRUE.equals(rhs.constantValue());
    }

    @Override
    public List<Element> subElements() {
        return List.of(lhs, rhs);
    }

    @Override
    public String toString() {
        return lhs + " && " + rhs;
    }
}
