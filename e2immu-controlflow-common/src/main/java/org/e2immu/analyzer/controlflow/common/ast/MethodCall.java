package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/*
call of a method or of a property accessor. A null qualifier stands for an implicit 'this' or, for static methods,
the declaring type.
 */
public class MethodCall implements Call {
    private final Expression qualifier;
    private final MethodInfo method;
    private final List<Expression> arguments;

    public MethodCall(Expression qualifier, MethodInfo method, List<Expression> arguments) {
        this.qualifier = qualifier;
        this.method = method;
        this.arguments = List.copyOf(arguments);
    }

    public Expression qualifier() {
        return qualifier;
    }

    public MethodInfo method() {
        return method;
    }

    @Override
    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public ParameterMode parameterMode(int argumentIndex) {
        return method.parameterMode(argumentIndex);
    }

    /*
    the receiver of the call is the current instance
     */
    public boolean isThisPreserving() {
        return !method.isStatic() && (qualifier == null || qualifier instanceof ThisAccess);
    }

    public boolean hasEvaluatedQualifier() {
        return qualifier != null && !(qualifier instanceof TypeAccess) && !(qualifier instanceof ThisAccess);
    }

    @Override
    public TypeInfo type() {
        return method.returnType();
    }

    @Override
    public List<Element> subElements() {
        List<Element> list = new ArrayList<>(arguments.size() + 1);
        if (qualifier != null) list.add(qualifier);
        list.addAll(arguments);
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        return (qualifier == null ? "" : qualifier + ".") + method.name() + "("
               + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
}
