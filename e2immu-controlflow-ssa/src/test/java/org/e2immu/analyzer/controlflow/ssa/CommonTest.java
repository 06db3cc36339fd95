package org.e2immu.analyzer.controlflow.ssa;

import org.e2immu.analyzer.controlflow.common.ast.*;
import org.e2immu.analyzer.controlflow.ssa.definition.Definition;
import org.e2immu.analyzer.controlflow.ssa.definition.PhiNode;
import org.e2immu.analyzer.controlflow.ssa.definition.Read;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CommonTest {
    protected Factory factory;
    protected TypeInfo X;
    protected MethodInfo log;

    @BeforeEach
    public void beforeEach() {
        factory = new Factory();
        X = factory.newType("X");
        log = factory.newMethod(X, "log", factory.newParameter(0, "i", factory.intType()));
    }

    protected MethodInfo method(String name, ParameterInfo... parameters) {
        return factory.newMethod(X, name, parameters);
    }

    protected LocalVariable local(String name) {
        return factory.newLocalVariable(name, factory.intType());
    }

    protected ExpressionStatement assign(Expression target, Expression value) {
        return factory.statement(factory.assign(target, value));
    }

    protected ExpressionStatement callStatement(MethodInfo methodInfo, Expression... arguments) {
        return factory.statement(factory.call(methodInfo, arguments));
    }

    protected Program program() {
        return new Program(List.of(X));
    }

    protected ProgramAnalysis analysis() {
        return new ProgramAnalysis(factory, program());
    }

    protected ProgramAnalysis analysis(ProgramAnalysis.Configuration configuration) {
        return new ProgramAnalysis(factory, program(), configuration);
    }

    protected CallableSsa ssa(MethodInfo methodInfo, Statement... statements) {
        methodInfo.setBody(factory.block(statements));
        CallableSsa ssa = analysis().ssaOf(methodInfo);
        assertConsistent(ssa);
        return ssa;
    }

    protected static Read single(List<Read> reads) {
        assertEquals(1, reads.size(), "Expected exactly one read, got " + reads);
        return reads.get(0);
    }

    /*
    every read has exactly one reaching definition, which lists the read among its reads
     */
    protected static void assertConsistent(CallableSsa ssa) {
        for (SourceVariable v : ssa.sourceVariables()) {
            for (Read read : ssa.readsOf(v)) {
                Definition d = ssa.definitionReaching(read);
                assertNotNull(d);
                assertEquals(v, d.variable());
                assertTrue(d.reads().contains(read), "Definition " + d + " does not list " + read);
            }
        }
        for (Definition d : ssa.definitions()) {
            if (d instanceof PhiNode phi) {
                assertFalse(phi.inputs().isEmpty(), "Phi without inputs: " + phi);
                assertFalse(phi.inputs().contains(phi));
            }
        }
    }
}
