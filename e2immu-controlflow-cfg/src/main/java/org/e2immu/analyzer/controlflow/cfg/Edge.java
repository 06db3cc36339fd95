package org.e2immu.analyzer.controlflow.cfg;

public record Edge(ControlFlowNode from, ControlFlowNode to, EdgeType type) {

    @Override
    public String toString() {
        return from + " " + type.arrow + " " + to;
    }
}
