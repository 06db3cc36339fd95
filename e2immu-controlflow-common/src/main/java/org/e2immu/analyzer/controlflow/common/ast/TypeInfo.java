package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

public class TypeInfo {
    private final String name;
    private final TypeInfo parent;
    private final boolean integral;
    private final List<FieldInfo> fields = new ArrayList<>();
    private final List<PropertyInfo> properties = new ArrayList<>();
    private final List<MethodInfo> methods = new ArrayList<>();

    public TypeInfo(String name, TypeInfo parent) {
        this(name, parent, false);
    }

    public TypeInfo(String name, TypeInfo parent, boolean integral) {
        this.name = Objects.requireNonNull(name);
        this.parent = parent;
        this.integral = integral;
    }

    public String name() {
        return name;
    }

    public TypeInfo parent() {
        return parent;
    }

    public boolean isIntegral() {
        return integral;
    }

    public boolean isSubtypeOf(TypeInfo other) {
        for (TypeInfo t = this; t != null; t = t.parent) {
            if (t == other) return true;
        }
        return false;
    }

    public List<FieldInfo> fields() {
        return fields;
    }

    public List<PropertyInfo> properties() {
        return properties;
    }

    public List<MethodInfo> methods() {
        return methods;
    }

    public Stream<MethodInfo> methodStream() {
        return Stream.concat(methods.stream(), properties.stream().flatMap(PropertyInfo::accessorStream));
    }

    void addField(FieldInfo fieldInfo) {
        fields.add(fieldInfo);
    }

    void addProperty(PropertyInfo propertyInfo) {
        properties.add(propertyInfo);
    }

    void addMethod(MethodInfo methodInfo) {
        methods.add(methodInfo);
    }

    public FieldInfo getFieldByName(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No field " + name + " in " + this.name));
    }

    public PropertyInfo getPropertyByName(String name) {
        return properties.stream().filter(p -> p.name().equals(name)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No property " + name + " in " + this.name));
    }

    public MethodInfo findUniqueMethod(String name, int parameters) {
        List<MethodInfo> list = methods.stream()
                .filter(m -> m.name().equals(name) && m.parameters().size() == parameters)
                .toList();
        if (list.size() != 1) {
            throw new IllegalArgumentException("Found " + list.size() + " methods " + name + " with "
                                               + parameters + " parameters in " + this.name);
        }
        return list.get(0);
    }

    @Override
    public String toString() {
        return name;
    }
}
