package org.e2immu.analyzer.controlflow.ssa;

import org.e2immu.analyzer.controlflow.common.ast.*;
import org.e2immu.analyzer.controlflow.ssa.callgraph.ComputeCallGraph;
import org.e2immu.analyzer.controlflow.ssa.definition.*;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestClosures extends CommonTest {

    /*
    int x = 1;
    Delegate d = () -> { x = x + 1; };
    d();
    log(x);
     */
    @DisplayName("captured local variable written in a closure")
    @Test
    public void test1() {
        MethodInfo m = method("m");
        LocalVariable x = local("x");
        LocalVariable d = factory.newLocalVariable("d", factory.delegateType());
        LambdaInfo li = factory.newLambdaInfo(m);
        VariableAccess xInLambda = factory.access(x);
        li.setBody(factory.block(assign(factory.access(x),
                factory.binary(xInLambda, BinaryOperation.Operator.ADD, factory.intLiteral(1)))));
        VariableAccess xInLog = factory.access(x);
        m.setBody(factory.block(
                factory.declare(x, factory.intLiteral(1)),
                factory.declare(d, factory.lambda(li)),
                factory.statement(factory.delegateCall(factory.access(d))),
                callStatement(log, xInLog)));

        ProgramAnalysis analysis = analysis();
        CallableSsa ssa = analysis.ssaOf(m);
        assertConsistent(ssa);
        SourceVariable sx = ssa.sourceVariable("x");
        assertFalse(sx.isCaptured());
        List<Definition> definitions = ssa.definitionsOf(sx);
        assertEquals("[def x@int x = 1, call x@d()]", definitions.toString());
        Definition d1 = definitions.get(0);
        Definition call = definitions.get(1);
        assertSame(call, ssa.definitionReaching(single(ssa.readsAt(xInLog))));
        assertSame(d1, call.priorDefinition());
        assertEquals(Set.of(li), d1.flowsIntoClosure());
        assertTrue(call.flowsIntoClosure().isEmpty());
        assertFalse(d1.flowsOutOfClosure());

        CallableSsa lambdaSsa = analysis.ssaOf(li);
        assertConsistent(lambdaSsa);
        SourceVariable captured = lambdaSsa.sourceVariable("x");
        assertTrue(captured.isCaptured());
        assertSame(m, ((SourceVariable.LocalScopeVariable) captured).declaringCallable());
        List<Definition> inLambda = lambdaSsa.definitionsOf(captured);
        assertEquals("[entry x, def x@x = x + 1]", inLambda.toString());
        Definition entry = inLambda.get(0);
        Definition write = inLambda.get(1);
        assertSame(entry, lambdaSsa.definitionReaching(single(lambdaSsa.readsAt(xInLambda))));
        assertFalse(entry.flowsOutOfClosure());
        assertTrue(write.flowsOutOfClosure());

        assertEquals(List.of(entry), analysis.closureEntryDefinitions(d1));
        assertEquals(List.of(call), analysis.closureOutflowDefinitions(write));
        assertEquals(List.of(), analysis.closureOutflowDefinitions(entry));
        assertEquals("X.m(0)->I->X.log(1), X.m(0)->X->" + li,
                ComputeCallGraph.print(analysis.callGraph()));
    }

    /*
    int x = 1;
    Delegate d = () -> log(x);
    x = 2;
    d();
    the closure sees the value at the time it runs, so the first write is dead
     */
    @DisplayName("a call running a closure that reads the variable keeps the last write alive")
    @Test
    public void test2() {
        MethodInfo m = method("m");
        LocalVariable x = local("x");
        LocalVariable d = factory.newLocalVariable("d", factory.delegateType());
        LambdaInfo li = factory.newLambdaInfo(m);
        li.setBody(factory.block(callStatement(log, factory.access(x))));
        m.setBody(factory.block(
                factory.declare(x, factory.intLiteral(1)),
                factory.declare(d, factory.lambda(li)),
                assign(factory.access(x), factory.intLiteral(2)),
                factory.statement(factory.delegateCall(factory.access(d)))));

        ProgramAnalysis analysis = analysis();
        CallableSsa ssa = analysis.ssaOf(m);
        assertConsistent(ssa);
        List<Definition> definitions = ssa.definitionsOf(ssa.sourceVariable("x"));
        assertEquals("[def x@x = 2]", definitions.toString());
        Definition d2 = definitions.get(0);
        assertEquals(Set.of(li), d2.flowsIntoClosure());
        assertTrue(d2.reads().isEmpty());

        CallableSsa lambdaSsa = analysis.ssaOf(li);
        List<Definition> inLambda = lambdaSsa.definitionsOf(lambdaSsa.sourceVariable("x"));
        assertEquals("[entry x]", inLambda.toString());
        assertEquals(inLambda, analysis.closureEntryDefinitions(d2));
    }
}
