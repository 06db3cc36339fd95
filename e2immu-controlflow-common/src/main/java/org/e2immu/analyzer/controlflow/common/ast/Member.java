package org.e2immu.analyzer.controlflow.common.ast;

/*
a field or a property
 */
public interface Member {

    TypeInfo owner();

    String name();

    TypeInfo type();

    boolean isStatic();

    default String fullyQualifiedName() {
        return owner().name() + "." + name();
    }
}
