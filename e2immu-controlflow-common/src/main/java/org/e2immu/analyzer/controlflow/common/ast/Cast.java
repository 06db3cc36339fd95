package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
(T) e, or e as T when safe. Only the unsafe variant can throw an InvalidCastException.
 */
public class Cast implements Expression {
    private final Expression expression;
    private final TypeInfo type;
    private final boolean safe;

    public Cast(Expression expression, TypeInfo type, boolean safe) {
        this.expression = expression;
        this.type = type;
        this.safe = safe;
    }

    public Expression expression() {
        return expression;
    }

    public boolean isSafe() {
        return safe;
    }

    @Override
    public TypeInfo type() {
        return type;
    }

    @Override
    public List<Element> subElements() {
        return List.of(expression);
    }

    @Override
    public String toString() {
        return safe ? expression + " as " + type : "(" + type + ") " + expression;
    }
}
