package org.e2immu.analyzer.controlflow.common.ast;

public interface Statement extends Element {
}
