package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;

/*
One case of a switch statement. The case itself is the node where the pattern is matched against the selector.
A default case has no pattern. An empty body falls through to the body of the next case.
 */
public class SwitchCase implements Element {
    private final Pattern pattern;
    private final Expression guard;
    private final List<Statement> body;

    public SwitchCase(Pattern pattern, Expression guard, List<Statement> body) {
        this.pattern = pattern;
        this.guard = guard;
        this.body = List.copyOf(body);
    }

    // null for the default case
    public Pattern pattern() {
        return pattern;
    }

    // null when absent
    public Expression guard() {
        return guard;
    }

    public List<Statement> body() {
        return body;
    }

    public boolean isDefault() {
        return pattern == null;
    }

    @Override
    public List<Element> subElements() {
        List<Element> list = new ArrayList<>(body.size() + 1);
        if (guard != null) list.add(guard);
        list.addAll(body);
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        return pattern == null ? "default:" : "case " + pattern + (guard == null ? "" : " when " + guard) + ":";
    }
}
