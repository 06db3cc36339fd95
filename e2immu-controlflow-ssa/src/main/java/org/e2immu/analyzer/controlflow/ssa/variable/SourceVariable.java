package org.e2immu.analyzer.controlflow.ssa.variable;

import org.e2immu.analyzer.controlflow.common.ast.Callable;
import org.e2immu.analyzer.controlflow.common.ast.LocalVariable;
import org.e2immu.analyzer.controlflow.common.ast.Member;

/*
The identity of a variable as seen by the SSA construction of one callable.

Equality is structural. Every source variable carries the callable in which it is used: a local variable captured
by a lambda is a different source variable in the lambda than in the callable that declares it.
 */
public interface SourceVariable {

    Callable callable();

    /*
    null for local variables
     */
    default Member member() {
        return null;
    }

    default boolean isCaptured() {
        return false;
    }

    /*
    the number of qualifiers between this variable and its root
     */
    default int depth() {
        return 0;
    }

    /*
    local variables and parameters; captured iff used in another callable than the declaring one
     */
    record LocalScopeVariable(Callable callable, LocalVariable variable,
                              Callable declaringCallable) implements SourceVariable {
        @Override
        public boolean isCaptured() {
            return callable != declaringCallable;
        }

        @Override
        public String toString() {
            return variable.name();
        }
    }

    /*
    a field or property of 'this', or a static one
     */
    record PlainFieldOrProp(Callable callable, Member member) implements SourceVariable {
        @Override
        public String toString() {
            return (member.isStatic() ? member.owner().name() : "this") + "." + member.name();
        }
    }

    /*
    a field or property of an instance that is itself held by a source variable, as in a.b.c
     */
    record QualifiedFieldOrProp(Callable callable, SourceVariable qualifier,
                                Member member) implements SourceVariable {
        @Override
        public int depth() {
            return qualifier.depth() + 1;
        }

        @Override
        public String toString() {
            return qualifier + "." + member.name();
        }
    }
}
