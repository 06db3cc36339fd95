package org.e2immu.analyzer.controlflow.common.ast;

public interface LoopStatement extends Statement {

    Statement body();
}
