package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
expression is pattern; a type pattern may bind a new local variable, written when the test succeeds
 */
public class IsPattern implements Expression {
    private final Expression expression;
    private final Pattern pattern;
    private final TypeInfo boolType;

    public IsPattern(Expression expression, Pattern pattern, TypeInfo boolType) {
        this.expression = expression;
        this.pattern = pattern;
        this.boolType = boolType;
    }

    public Expression expression() {
        return expression;
    }

    public Pattern pattern() {
        return pattern;
    }

    @Override
    public TypeInfo type() {
        return boolType;
    }

    @Override
    public List<Element> subElements() {
        return List.of(expression);
    }

    @Override
    public String toString() {
        return expression + " is " + pattern;
    }
}
