package org.e2immu.analyzer.controlflow.ssa;

import org.e2immu.analyzer.controlflow.common.AnalyzerException;
import org.e2immu.analyzer.controlflow.common.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestProgramAnalysis extends CommonTest {

    /*
    an expression the control flow graph builder cannot handle
     */
    private record BrokenExpression(TypeInfo type) implements Expression {
        @Override
        public boolean isConstant() {
            throw new UnsupportedOperationException("Broken");
        }

        @Override
        public List<Element> subElements() {
            return List.of();
        }
    }

    private MethodInfo broken() {
        MethodInfo m = method("ok");
        m.setBody(factory.block(callStatement(log, factory.intLiteral(1))));
        MethodInfo broken = method("broken");
        broken.setBody(factory.block(callStatement(log, new BrokenExpression(factory.intType()))));
        return broken;
    }

    @DisplayName("errors are stored per callable")
    @Test
    public void test1() {
        MethodInfo broken = broken();
        ProgramAnalysis analysis = analysis(new ProgramAnalysis.Configuration.Builder()
                .setStoreErrors(true).build());
        ProgramAnalysis.Output output = analysis.analyze();
        assertEquals(1, output.analyzerExceptions().size());
        AnalyzerException ae = output.analyzerExceptions().get(0);
        assertSame(broken, ae.getCallable());
        assertInstanceOf(UnsupportedOperationException.class, ae.getCause());
        assertEquals(1, output.results().size());
        assertEquals("X.ok(0)", output.results().keySet().iterator().next().fullyQualifiedName());
    }

    @DisplayName("errors are rethrown when not stored")
    @Test
    public void test2() {
        broken();
        ProgramAnalysis analysis = analysis();
        assertFalse(analysis.configuration().storeErrors());
        assertThrows(UnsupportedOperationException.class, analysis::analyze);
    }

    @DisplayName("parallel analysis, cached results")
    @Test
    public void test3() {
        for (int i = 0; i < 20; i++) {
            MethodInfo mi = method("m" + i);
            LocalVariable x = local("x");
            mi.setBody(factory.block(factory.declare(x, factory.intLiteral(i)), callStatement(log, factory.access(x))));
        }
        Program program = program();
        ProgramAnalysis analysis = analysis(new ProgramAnalysis.Configuration.Builder().setParallel(true).build());
        ProgramAnalysis.Output output = analysis.analyze();
        assertTrue(output.analyzerExceptions().isEmpty());
        assertEquals(program.callables().size(), output.results().size());
        assertEquals(20, output.results().size());
        for (Callable callable : program.callables()) {
            assertSame(output.results().get(callable), analysis.ssaOf(callable));
            assertEquals(1, output.results().get(callable).definitions().size());
        }
    }

    @DisplayName("only callables with a body can be analyzed")
    @Test
    public void test4() {
        ProgramAnalysis analysis = analysis();
        assertThrows(IllegalArgumentException.class, () -> analysis.ssaOf(log));
        assertThrows(IllegalArgumentException.class, () -> analysis.variableAccesses(log));
    }
}
