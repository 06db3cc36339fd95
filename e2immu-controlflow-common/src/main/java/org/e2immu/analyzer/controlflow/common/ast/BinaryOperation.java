package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;
import java.util.Objects;

public class BinaryOperation implements Expression {

    public enum Operator {
        ADD("+"), SUBTRACT("-"), MULTIPLY("*"), DIVIDE("/"), REMAINDER("%"),
        EQUALS("=="), NOT_EQUALS("!="), LESS("<"), LESS_EQUALS("<="), GREATER(">"), GREATER_EQUALS(">="),
        BIT_AND("&"), BIT_OR("|"), BIT_XOR("^");

        public final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public boolean isDivision() {
            return this == DIVIDE || this == REMAINDER;
        }
    }

    private final Expression lhs;
    private final Operator operator;
    private final Expression rhs;
    private final TypeInfo type;

    public BinaryOperation(Expression lhs, Operator operator, Expression rhs, TypeInfo type) {
        this.lhs = lhs;
        this.operator = operator;
        this.rhs = rhs;
        this.type = type;
    }

    public Expression lhs() {
        return lhs;
    }

    public Operator operator() {
        return operator;
    }

    public Expression rhs() {
        return rhs;
    }

    /*
    integral division can throw a DivideByZeroException
     */
    public boolean isIntegralDivision() {
        return operator.isDivision() && type.isIntegral();
    }

    @Override
    public TypeInfo type() {
        return type;
    }

    @Override
    public boolean isConstant() {
        return lhs.isConstant() && rhs.isConstant() && foldedValue() != null;
    }

    @Override
    public Object constantValue() {
        Object value = foldedValue();
        if (value == null) throw new UnsupportedOperationException("Not a constant: " + this);
        return value;
    }

    private Object foldedValue() {
        if (!lhs.isConstant() || !rhs.isConstant()) return null;
        Object l = lhs.constantValue();
        Object r = rhs.constantValue();
        if (l instanceof Integer a && r instanceof Integer b) {
            return switch (operator) {
                case ADD -> a + b;
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                case DIVIDE -> b == 0 ? null : a / b;
                case REMAINDER -> b == 0 ? null : a % b;
                case EQUALS -> a.equals(b);
                case NOT_EQUALS -> !a.equals(b);
                case LESS -> a < b;
                case LESS_EQUALS -> a <= b;
                case GREATER -> a > b;
                case GREATER_EQUALS -> a >= b;
                case BIT_AND -> a & b;
                case BIT_OR -> a | b;
                case BIT_XOR -> a ^ b;
            };
        }
        if (l instanceof Boolean a && r instanceof Boolean b) {
            return switch (operator) {
                case EQUALS -> a.equals(b);
                case NOT_EQUALS, BIT_XOR -> !a.equals(b);
                case BIT_AND -> a && b;
                case BIT_OR -> a || b;
                default -> null;
            };
        }
        if (operator == Operator.EQUALS) return Objects.equals(l, r);
        if (operator == Operator.NOT_EQUALS) return !Objects.equals(l, r);
        return null;
    }

    @Override
    public List<Element> subElements() {
        return List.of(lhs, rhs);
    }

    @Override
    public String toString() {
        return lhs + " " + operator.symbol + " " + rhs;
    }
}
