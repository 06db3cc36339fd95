package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/*
invocation of a delegate-valued expression, e.g. a lambda stored in a local variable
 */
public class DelegateCall implements Call {
    private final Expression delegate;
    private final List<Expression> arguments;
    private final TypeInfo returnType;

    public DelegateCall(Expression delegate, List<Expression> arguments, TypeInfo returnType) {
        this.delegate = delegate;
        this.arguments = List.copyOf(arguments);
        this.returnType = returnType;
    }

    public Expression delegate() {
        return delegate;
    }

    @Override
    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public ParameterMode parameterMode(int argumentIndex) {
        return ParameterMode.VALUE;
    }

    @Override
    public TypeInfo type() {
        return returnType;
    }

    @Override
    public List<Element> subElements() {
        List<Element> list = new ArrayList<>(arguments.size() + 1);
        list.add(delegate);
        list.addAll(arguments);
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        return delegate + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
}
