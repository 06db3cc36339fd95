package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/*
new T(arguments) { member initializers }. The constructor runs after the arguments have been evaluated, and
before the member initializers.
 */
public class ObjectCreation implements Call {
    private final MethodInfo constructor;
    private final List<Expression> arguments;
    private final List<MemberInitializer> initializers;

    public ObjectCreation(MethodInfo constructor, List<Expression> arguments, List<MemberInitializer> initializers) {
        assert constructor.isConstructor();
        this.constructor = constructor;
        this.arguments = List.copyOf(arguments);
        this.initializers = List.copyOf(initializers);
    }

    public MethodInfo constructor() {
        return constructor;
    }

    @Override
    public List<Expression> arguments() {
        return arguments;
    }

    public List<MemberInitializer> initializers() {
        return initializers;
    }

    @Override
    public ParameterMode parameterMode(int argumentIndex) {
        return constructor.parameterMode(argumentIndex);
    }

    @Override
    public TypeInfo type() {
        return constructor.declaringType();
    }

    @Override
    public List<Element> subElements() {
        List<Element> list = new ArrayList<>(arguments);
        list.addAll(initializers);
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        return "new " + constructor.declaringType() + "("
               + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")"
               + (initializers.isEmpty() ? "" : " {...}");
    }
}
