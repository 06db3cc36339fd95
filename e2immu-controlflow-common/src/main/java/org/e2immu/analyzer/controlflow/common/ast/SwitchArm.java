package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;

/*
pattern [when guard] => result
 */
public class SwitchArm implements Element {
    private final Pattern pattern;
    private final Expression guard;
    private final Expression result;

    public SwitchArm(Pattern pattern, Expression guard, Expression result) {
        this.pattern = pattern;
        this.guard = guard;
        this.result = result;
    }

    public Pattern pattern() {
        return pattern;
    }

    public Expression guard() {
        return guard;
    }

    public Expression result() {
        return result;
    }

    @Override
    public List<Element> subElements() {
        List<Element> list = new ArrayList<>(2);
        if (guard != null) list.add(guard);
        list.add(result);
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        return pattern + (guard == null ? "" : " when " + guard) + " =>";
    }
}
