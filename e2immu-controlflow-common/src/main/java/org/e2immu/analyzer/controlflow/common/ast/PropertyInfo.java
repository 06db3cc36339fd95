package org.e2immu.analyzer.controlflow.common.ast;

import java.util.Objects;
import java.util.stream.Stream;

public class PropertyInfo implements Member {
    private final TypeInfo owner;
    private final String name;
    private final TypeInfo type;
    private final boolean isStatic;
    private final boolean overridable;
    private final boolean autoImplemented;
    private MethodInfo getter;
    private MethodInfo setter;

    public PropertyInfo(TypeInfo owner, String name, TypeInfo type, boolean isStatic, boolean overridable,
                        boolean autoImplemented) {
        this.owner = owner;
        this.name = name;
        this.type = type;
        this.isStatic = isStatic;
        this.overridable = overridable;
        this.autoImplemented = autoImplemented;
        owner.addProperty(this);
    }

    @Override
    public TypeInfo owner() {
        return owner;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TypeInfo type() {
        return type;
    }

    @Override
    public boolean isStatic() {
        return isStatic;
    }

    public boolean isOverridable() {
        return overridable;
    }

    public boolean isAutoImplemented() {
        return autoImplemented;
    }

    /*
    a property that behaves like a field: reading it cannot execute arbitrary code
     */
    public boolean isFieldLike() {
        return !overridable && autoImplemented;
    }

    public MethodInfo getter() {
        return getter;
    }

    public MethodInfo setter() {
        return setter;
    }

    void setGetter(MethodInfo getter) {
        assert this.getter == null;
        this.getter = getter;
    }

    void setSetter(MethodInfo setter) {
        assert this.setter == null;
        this.setter = setter;
    }

    Stream<MethodInfo> accessorStream() {
        return Stream.of(getter, setter).filter(Objects::nonNull);
    }

    @Override
    public String toString() {
        return fullyQualifiedName();
    }
}
