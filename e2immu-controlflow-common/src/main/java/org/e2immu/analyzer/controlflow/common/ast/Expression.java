package org.e2immu.analyzer.controlflow.common.ast;

public interface Expression extends Element {

    TypeInfo type();

    /*
    compile-time constant: literals, and operators applied to constants only.
     */
    default boolean isConstant() {
        return false;
    }

    /*
    only meaningful when isConstant() is true
     */
    default Object constantValue() {
        throw new UnsupportedOperationException("Not a constant: " + this);
    }
}
