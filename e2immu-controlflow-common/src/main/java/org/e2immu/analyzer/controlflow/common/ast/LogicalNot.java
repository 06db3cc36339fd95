package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class LogicalNot implements Expression {
    private final Expression operand;

    public LogicalNot(Expression operand) {
        this.operand = operand;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public TypeInfo type() {
        return operand.type();
    }

    @Override
    public boolean isConstant() {
        return operand.isConstant();
    }

    @Override
    public Object constantValue() {
        return !Boolean.TRUE.equals(operand.constantValue());
    }

    @Override
    public List<Element> subElements() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return "!" + operand;
    }
}
