package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
simple (operator == null) or compound assignment. The target is a VariableAccess, MemberAccess or ArrayAccess.
 */
public class Assignment implements Expression {
    private final Expression target;
    private final BinaryOperation.Operator operator;
    private final Expression value;

    public Assignment(Expression target, BinaryOperation.Operator operator, Expression value) {
        assert target instanceof VariableAccess || target instanceof MemberAccess || target instanceof ArrayAccess;
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression target() {
        return target;
    }

    public BinaryOperation.Operator operator() {
        return operator;
    }

    public Expression value() {
        return value;
    }

    public boolean isCompound() {
        return operator != null;
    }

    @Override
    public TypeInfo type() {
        return target.type();
    }

    @Override
    public List<Element> subElements() {
        return List.of(target, value);
    }

    @Override
    public String toString() {
        return target + " " + (operator == null ? "" : operator.symbol) + "= " + value;
    }
}
