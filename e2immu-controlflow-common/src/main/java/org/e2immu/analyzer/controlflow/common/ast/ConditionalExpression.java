package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class ConditionalExpression implements Expression {
    private final Expression condition;
    private final Expression ifTrue;
    private final Expression ifFalse;

    public ConditionalExpression(Expression condition, Expression ifTrue, Expression ifFalse) {
        this.condition = condition;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    public Expression condition() {
        return condition;
    }

    public Expression ifTrue() {
        return ifTrue;
    }

    public Expression ifFalse() {
        return ifFalse;
    }

    @Override
    public TypeInfo type() {
        return ifTrue.type();
    }

    @Override
    public boolean isConstant() {
        return condition.isConstant() && ifTrue.isConstant() && ifFalse.isConstant();
    }

    @Override
    public Object constantValue() {
        return Boolean.TRUE.equals(condition.constantValue()) ? ifTrue.constantValue() : ifFalse.constantValue();
    }

    @Override
    public List<Element> subElements() {
        return List.of(condition, ifTrue, ifFalse);
    }

    @Override
    public String toString() {
        return condition + " ? " + ifTrue + " : " + ifFalse;
    }
}
