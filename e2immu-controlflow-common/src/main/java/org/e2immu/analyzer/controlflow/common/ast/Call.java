package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
method calls, delegate calls and object creations: expressions that may run code of another callable
 */
public interface Call extends Expression {

    List<Expression> arguments();

    ParameterMode parameterMode(int argumentIndex);
}
