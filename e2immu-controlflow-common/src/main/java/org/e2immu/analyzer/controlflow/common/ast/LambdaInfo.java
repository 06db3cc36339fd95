package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;
import java.util.Objects;

/*
anonymous function or local function. Its body has its own control flow graph; local variables of the
enclosing callables that it accesses are "captured".
 */
public class LambdaInfo implements Callable {
    private final Callable enclosingCallable;
    private final int index;
    private final List<ParameterInfo> parameters;
    private Element body;

    public LambdaInfo(Callable enclosingCallable, int index, List<ParameterInfo> parameters) {
        this.enclosingCallable = Objects.requireNonNull(enclosingCallable);
        this.index = index;
        this.parameters = List.copyOf(parameters);
    }

    public void setBody(Element body) {
        if (this.body != null) throw new IllegalStateException("Body of lambda has already been set");
        assert body instanceof Statement || body instanceof Expression;
        this.body = body;
    }

    @Override
    public Element body() {
        return body;
    }

    @Override
    public String name() {
        return "$" + index;
    }

    @Override
    public TypeInfo declaringType() {
        return enclosingCallable.declaringType();
    }

    @Override
    public List<ParameterInfo> parameters() {
        return parameters;
    }

    @Override
    public boolean isStatic() {
        return enclosingCallable.isStatic();
    }

    @Override
    public Callable enclosingCallable() {
        return enclosingCallable;
    }

    @Override
    public String fullyQualifiedName() {
        return enclosingCallable.fullyQualifiedName() + "." + name();
    }

    @Override
    public String toString() {
        return fullyQualifiedName();
    }
}
