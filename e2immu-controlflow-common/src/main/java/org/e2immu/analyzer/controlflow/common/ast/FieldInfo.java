package org.e2immu.analyzer.controlflow.common.ast;

public class FieldInfo implements Member {
    private final TypeInfo owner;
    private final String name;
    private final TypeInfo type;
    private final boolean isStatic;
    private final boolean isVolatile;

    public FieldInfo(TypeInfo owner, String name, TypeInfo type, boolean isStatic, boolean isVolatile) {
        this.owner = owner;
        this.name = name;
        this.type = type;
        this.isStatic = isStatic;
        this.isVolatile = isVolatile;
        owner.addField(this);
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

    public boolean isVolatile() {
        return isVolatile;
    }

    @Override
    public String toString() {
        return fullyQualifiedName();
    }
}
