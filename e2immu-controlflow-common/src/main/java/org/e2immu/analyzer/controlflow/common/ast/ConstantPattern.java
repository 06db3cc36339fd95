package org.e2immu.analyzer.controlflow.common.ast;

public record ConstantPattern(Expression constant) implements Pattern {

    public ConstantPattern {
        assert constant.isConstant();
    }

    public Object value() {
        return constant.constantValue();
    }

    @Override
    public String toString() {
        return constant.toString();
    }
}
