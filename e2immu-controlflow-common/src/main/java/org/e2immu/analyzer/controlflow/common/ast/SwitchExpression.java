package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;

public class SwitchExpression implements Expression {
    private final Expression selector;
    private final List<SwitchArm> arms;
    private final TypeInfo type;

    public SwitchExpression(Expression selector, List<SwitchArm> arms, TypeInfo type) {
        this.selector = selector;
        this.arms = List.copyOf(arms);
        this.type = type;
    }

    public Expression selector() {
        return selector;
    }

    public List<SwitchArm> arms() {
        return arms;
    }

    @Override
    public TypeInfo type() {
        return type;
    }

    @Override
    public List<Element> subElements() {
        List<Element> list = new ArrayList<>(arms.size() + 1);
        list.add(selector);
        list.addAll(arms);
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        return selector + " switch {...}";
    }
}
