package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;

public class SwitchStatement implements Statement {
    private final Expression selector;
    private final List<SwitchCase> cases;

    public SwitchStatement(Expression selector, List<SwitchCase> cases) {
        this.selector = selector;
        this.cases = List.copyOf(cases);
    }

    public Expression selector() {
        return selector;
    }

    /*
    in declaration order
     */
    public List<SwitchCase> cases() {
        return cases;
    }

    /*
    the order in which the cases are tried: declaration order, default case last
     */
    public List<SwitchCase> casesInEvaluationOrder() {
        List<SwitchCase> list = new ArrayList<>(cases.size());
        cases.stream().filter(c -> !c.isDefault()).forEach(list::add);
        cases.stream().filter(SwitchCase::isDefault).forEach(list::add);
        return list;
    }

    public SwitchCase defaultCase() {
        return cases.stream().filter(SwitchCase::isDefault).findFirst().orElse(null);
    }

    @Override
    public List<Element> subElements() {
        List<Element> list = new ArrayList<>(cases.size() + 1);
        list.add(selector);
        list.addAll(cases);
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        return "switch (" + selector + ") ...";
    }
}
