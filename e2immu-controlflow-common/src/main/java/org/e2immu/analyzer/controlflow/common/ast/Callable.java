package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
Anything with a body that gets its own control flow graph: methods, constructors, accessors, lambdas.
 */
public interface Callable {

    String name();

    TypeInfo declaringType();

    List<ParameterInfo> parameters();

    /*
    a Statement (usually a Block) or, for expression-bodied lambdas, an Expression; null when there is no body
     */
    Element body();

    boolean isStatic();

    /*
    the callable in which this one is nested; null for members of a type
     */
    default Callable enclosingCallable() {
        return null;
    }

    default boolean hasBody() {
        return body() != null;
    }

    String fullyQualifiedName();
}
