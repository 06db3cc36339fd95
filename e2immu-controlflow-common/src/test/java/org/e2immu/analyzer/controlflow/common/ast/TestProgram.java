package org.e2immu.analyzer.controlflow.common.ast;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TestProgram {

    @Test
    public void test() {
        Factory factory = new Factory();
        TypeInfo x = factory.newType("X");
        MethodInfo noBody = factory.newMethod(x, "abstractMethod");
        MethodInfo m = factory.newMethod(x, "m");
        LambdaInfo outer = factory.newLambdaInfo(m);
        LambdaInfo inner = factory.newLambdaInfo(outer);
        inner.setBody(factory.block(factory.statement(factory.call(noBody))));
        outer.setBody(factory.block(factory.statement(factory.lambda(inner))));
        m.setBody(factory.block(factory.statement(factory.lambda(outer))));
        PropertyInfo p = factory.newProperty(x, "P", factory.intType(), false, false, false);
        p.getter().setBody(factory.block(factory.returnStatement(factory.intLiteral(3))));

        Program program = new Program(List.of(x));
        assertEquals("X.m(0), X.m(0).$0, X.m(0).$0.$0, X.get_P(0)", program.callables().stream()
                .map(Callable::fullyQualifiedName).collect(Collectors.joining(", ")));
        assertEquals(List.of(outer), Program.lambdasIn(m).toList());
        assertEquals(4, program.methodStream().count());
        assertSame(m, x.findUniqueMethod("m", 0));
        assertThrows(IllegalArgumentException.class, () -> x.findUniqueMethod("n", 0));
        assertSame(p, x.getPropertyByName("P"));
        assertFalse(p.isFieldLike());
        assertTrue(factory.newAutoProperty(x, "Q", factory.intType()).isFieldLike());
    }

    @Test
    public void testTypes() {
        Factory factory = new Factory();
        assertTrue(factory.invalidCastExceptionType().isSubtypeOf(factory.exceptionType()));
        assertTrue(factory.exceptionType().isSubtypeOf(factory.exceptionType()));
        assertFalse(factory.exceptionType().isSubtypeOf(factory.systemExceptionType()));
        assertTrue(factory.intType().isIntegral());
        assertEquals("1 / 0", factory.binary(factory.intLiteral(1), BinaryOperation.Operator.DIVIDE,
                factory.intLiteral(0)).toString());
    }
}
