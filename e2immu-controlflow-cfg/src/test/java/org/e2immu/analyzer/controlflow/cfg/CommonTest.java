package org.e2immu.analyzer.controlflow.cfg;

import org.e2immu.analyzer.controlflow.common.ast.*;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CommonTest {
    protected Factory factory;
    protected ControlFlowGraphBuilder builder;
    protected TypeInfo X;
    protected MethodInfo call;
    protected MethodInfo a;
    protected MethodInfo b;
    protected MethodInfo log;

    @BeforeEach
    public void beforeEach() {
        factory = new Factory();
        builder = new ControlFlowGraphBuilder(factory);
        X = factory.newType("X");
        call = factory.newMethod(X, "call");
        a = factory.newMethod(X, "a");
        b = factory.newMethod(X, "b");
        log = factory.newMethod(X, "log", factory.newParameter(0, "i", factory.intType()));
    }

    protected MethodInfo method(String name, ParameterInfo... parameters) {
        return factory.newMethod(X, name, parameters);
    }

    protected ControlFlowGraph build(MethodInfo methodInfo, Statement... statements) {
        methodInfo.setBody(factory.block(statements));
        return builder.build(methodInfo);
    }

    protected ExpressionStatement callStatement(MethodInfo methodInfo, Expression... arguments) {
        return factory.statement(factory.call(methodInfo, arguments));
    }

    protected static ControlFlowNode node(ControlFlowGraph cfg, Element element) {
        List<ControlFlowNode> nodes = cfg.nodesOf(element);
        assertEquals(1, nodes.size(), "Expected exactly one node for " + element + ", got " + nodes);
        return nodes.get(0);
    }

    protected static String print(List<ControlFlowNode> nodes) {
        return nodes.stream().map(Object::toString).collect(Collectors.joining(", "));
    }
}
