package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;
import java.util.Objects;

public class MethodInfo implements Callable {

    public enum Kind {METHOD, CONSTRUCTOR, GETTER, SETTER}

    private final TypeInfo declaringType;
    private final String name;
    private final Kind kind;
    private final TypeInfo returnType;
    private final boolean isStatic;
    private final boolean isVirtual;
    private final List<ParameterInfo> parameters;
    private final MethodInfo overrides;
    private Element body;

    public MethodInfo(TypeInfo declaringType, String name, Kind kind, TypeInfo returnType, boolean isStatic,
                      boolean isVirtual, List<ParameterInfo> parameters, MethodInfo overrides) {
        this.declaringType = Objects.requireNonNull(declaringType);
        this.name = name;
        this.kind = kind;
        this.returnType = returnType;
        this.isStatic = isStatic;
        this.isVirtual = isVirtual;
        this.parameters = List.copyOf(parameters);
        this.overrides = overrides;
        declaringType.addMethod(this);
    }

    MethodInfo(PropertyInfo propertyInfo, Kind kind, List<ParameterInfo> parameters, TypeInfo returnType) {
        this.declaringType = propertyInfo.owner();
        this.name = (kind == Kind.GETTER ? "get_" : "set_") + propertyInfo.name();
        this.kind = kind;
        this.returnType = returnType;
        this.isStatic = propertyInfo.isStatic();
        this.isVirtual = propertyInfo.isOverridable();
        this.parameters = List.copyOf(parameters);
        this.overrides = null;
    }

    public void setBody(Element body) {
        if (this.body != null) throw new IllegalStateException("Body of " + name + " has already been set");
        assert body instanceof Statement || body instanceof Expression;
        this.body = body;
    }

    @Override
    public Element body() {
        return body;
    }

    @Override
    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isConstructor() {
        return kind == Kind.CONSTRUCTOR;
    }

    public TypeInfo returnType() {
        return returnType;
    }

    @Override
    public TypeInfo declaringType() {
        return declaringType;
    }

    @Override
    public boolean isStatic() {
        return isStatic;
    }

    public boolean isVirtual() {
        return isVirtual;
    }

    public MethodInfo overrides() {
        return overrides;
    }

    @Override
    public List<ParameterInfo> parameters() {
        return parameters;
    }

    public ParameterMode parameterMode(int index) {
        return index < parameters.size() ? parameters.get(index).mode() : ParameterMode.VALUE;
    }

    @Override
    public String fullyQualifiedName() {
        return declaringType.name() + "." + name + "(" + parameters.size() + ")";
    }

    @Override
    public String toString() {
        return fullyQualifiedName();
    }
}
