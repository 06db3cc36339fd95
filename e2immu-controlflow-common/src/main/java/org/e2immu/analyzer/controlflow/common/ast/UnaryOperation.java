package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
arithmetic unary operators; increments and decrements are compound assignments, logical negation is LogicalNot
 */
public class UnaryOperation implements Expression {

    public enum Operator {MINUS, BIT_NOT}

    private final Operator operator;
    private final Expression operand;

    public UnaryOperation(Operator operator, Expression operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public Operator operator() {
        return operator;
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
        return operand.isConstant() && operand.constantValue() instanceof Integer;
    }

    @Override
    public Object constantValue() {
        if (!isConstant()) throw new UnsupportedOperationException("Not a constant: " + this);
        int i = (Integer) operand.constantValue();
        return operator == Operator.MINUS ? -i : ~i;
    }

    @Override
    public List<Element> subElements() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return (operator == Operator.MINUS ? "-" : "~") + operand;
    }
}
