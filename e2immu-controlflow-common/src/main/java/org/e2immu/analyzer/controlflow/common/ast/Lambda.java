package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
the expression that creates a closure. Evaluating it does not execute the body.
 */
public class Lambda implements Expression {
    private final LambdaInfo lambdaInfo;
    private final TypeInfo delegateType;

    public Lambda(LambdaInfo lambdaInfo, TypeInfo delegateType) {
        this.lambdaInfo = lambdaInfo;
        this.delegateType = delegateType;
    }

    public LambdaInfo lambdaInfo() {
        return lambdaInfo;
    }

    @Override
    public TypeInfo type() {
        return delegateType;
    }

    @Override
    public List<Element> subElements() {
        return List.of();
    }

    @Override
    public String toString() {
        return "(" + lambdaInfo.name() + ")";
    }
}
