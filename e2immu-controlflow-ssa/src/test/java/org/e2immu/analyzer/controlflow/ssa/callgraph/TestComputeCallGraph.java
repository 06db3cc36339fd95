package org.e2immu.analyzer.controlflow.ssa.callgraph;

import org.e2immu.analyzer.controlflow.common.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.e2immu.analyzer.controlflow.ssa.callgraph.ComputeCallGraph.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestComputeCallGraph {

    @Test
    public void test() {
        assertEquals("I", edgeValuePrinter(INTRA_INSTANCE));
        assertEquals("X", edgeValuePrinter(CROSS_INSTANCE));
        assertEquals("IX", edgeValuePrinter(INTRA_INSTANCE | CROSS_INSTANCE));
        assertTrue(isIntraInstance(INTRA_INSTANCE | CROSS_INSTANCE));
        assertFalse(isIntraInstance(CROSS_INSTANCE));
    }

    @DisplayName("virtual dispatch to overriding methods")
    @Test
    public void test1() {
        Factory factory = new Factory();
        TypeInfo X = factory.newType("X");
        TypeInfo Y = factory.newType("Y", X);
        MethodInfo run = factory.newMethod(X, "run", factory.voidType(), false, true, null, List.of());
        MethodInfo runY = factory.newMethod(Y, "run", factory.voidType(), false, true, run, List.of());
        MethodInfo m = factory.newMethod(X, "m");
        m.setBody(factory.block(factory.statement(factory.call(run))));

        ComputeCallGraph ccg = new ComputeCallGraph(new Program(List.of(X, Y))).go();
        assertEquals("X.m(0)->I->X.run(0), X.m(0)->I->Y.run(0)", print(ccg.graph()));
        assertEquals(List.of(run, runY), ccg.dispatch(run));
        assertEquals(List.of(m), ccg.dispatch(m));
    }

    /*
    void apply(Delegate f) { f(); }
    void m2() { apply(() -> log(1)); }
     */
    @DisplayName("a lambda passed as argument is called through the parameter")
    @Test
    public void test2() {
        Factory factory = new Factory();
        TypeInfo X = factory.newType("X");
        MethodInfo log = factory.newMethod(X, "log", factory.newParameter(0, "i", factory.intType()));
        ParameterInfo f = factory.newParameter(0, "f", factory.delegateType());
        MethodInfo apply = factory.newMethod(X, "apply", f);
        DelegateCall delegateCall = factory.delegateCall(factory.access(f));
        apply.setBody(factory.block(factory.statement(delegateCall)));
        MethodInfo m2 = factory.newMethod(X, "m2");
        LambdaInfo li = factory.newLambdaInfo(m2);
        li.setBody(factory.block(factory.statement(factory.call(log, factory.intLiteral(1)))));
        m2.setBody(factory.block(factory.statement(factory.call(apply, factory.lambda(li)))));

        ComputeCallGraph ccg = new ComputeCallGraph(new Program(List.of(X))).go();
        assertEquals("X.apply(1)->X->X.m2(0).$0, X.m2(0)->I->X.apply(1), X.m2(0).$0->I->X.log(1)",
                print(ccg.graph()));
        assertEquals("[X.m2(0).$0 (X)]", ccg.callTargets(delegateCall).toString());
    }

    /*
    a lambda handed to a method without body is assumed to be called there
     */
    @DisplayName("lambda passed to a callable without body")
    @Test
    public void test3() {
        Factory factory = new Factory();
        TypeInfo X = factory.newType("X");
        MethodInfo external = factory.newMethod(X, "external",
                factory.newParameter(0, "f", factory.delegateType()));
        MethodInfo m = factory.newMethod(X, "m");
        LambdaInfo li = factory.newLambdaInfo(m);
        li.setBody(factory.block());
        MethodCall call = factory.call(external, factory.lambda(li));
        m.setBody(factory.block(factory.statement(call)));

        ComputeCallGraph ccg = new ComputeCallGraph(new Program(List.of(X))).go();
        assertEquals("X.m(0)->I->X.external(1), X.m(0)->X->X.m(0).$0", print(ccg.graph()));
        assertEquals("[X.external(1) (I), X.m(0).$0 (X)]", ccg.callTargets(call).toString());
    }
}
