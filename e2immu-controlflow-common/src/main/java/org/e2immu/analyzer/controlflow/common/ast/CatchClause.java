package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;

/*
The clause itself is the node at which the exception type is matched. The variable, when present, is written
when the clause matches. A general catch clause has neither type nor variable.
 */
public class CatchClause implements Element {
    private final TypeInfo exceptionType;
    private final LocalVariable variable;
    private final Expression filter;
    private final Block body;

    public CatchClause(TypeInfo exceptionType, LocalVariable variable, Expression filter, Block body) {
        this.exceptionType = exceptionType;
        this.variable = variable;
        this.filter = filter;
        this.body = body;
    }

    // null for a general catch clause
    public TypeInfo exceptionType() {
        return exceptionType;
    }

    public LocalVariable variable() {
        return variable;
    }

    public Expression filter() {
        return filter;
    }

    public Block body() {
        return body;
    }

    public boolean isGeneral() {
        return exceptionType == null;
    }

    @Override
    public List<Element> subElements() {
        List<Element> list = new ArrayList<>(2);
        if (filter != null) list.add(filter);
        list.add(body);
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        if (exceptionType == null) return "catch";
        return "catch (" + exceptionType + (variable == null ? "" : " " + variable) + ")"
               + (filter == null ? "" : " when (" + filter + ")");
    }
}
