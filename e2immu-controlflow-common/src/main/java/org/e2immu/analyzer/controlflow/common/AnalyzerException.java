package org.e2immu.analyzer.controlflow.common;

import org.e2immu.analyzer.controlflow.common.ast.Callable;

public class AnalyzerException extends RuntimeException {
    private final Callable callable;

    public AnalyzerException(Callable callable, Throwable throwable) {
        super("Analysis of " + callable.fullyQualifiedName() + " failed", throwable);
        this.callable = callable;
    }

    public Callable getCallable() {
        return callable;
    }
}
