package org.e2immu.analyzer.controlflow.ssa.variable;

import org.e2immu.analyzer.controlflow.common.ast.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TestSourceVariableResolver {
    private Factory factory;
    private TypeInfo X;
    private MethodInfo log;
    private FieldInfo f;

    @BeforeEach
    public void beforeEach() {
        factory = new Factory();
        X = factory.newType("X");
        log = factory.newMethod(X, "log", factory.newParameter(0, "i", factory.intType()));
        f = factory.newField(X, "f", factory.intType());
    }

    private Statement log(Expression e) {
        return factory.statement(factory.call(log, e));
    }

    private static String print(Iterable<SourceVariable> variables) {
        StringBuilder sb = new StringBuilder();
        for (SourceVariable v : variables) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(v);
        }
        return sb.toString();
    }

    private MethodInfo fieldsAndProperties() {
        FieldInfo g = factory.newField(X, "g", factory.intType());
        FieldInfo v = factory.newField(X, "v", factory.intType(), false, true);
        PropertyInfo p = factory.newProperty(X, "p", factory.intType(), false, true, false);
        ParameterInfo a = factory.newParameter(0, "a", X);
        MethodInfo m = factory.newMethod(X, "m", a);
        m.setBody(factory.block(
                log(factory.access(f)),
                factory.statement(factory.assign(factory.access(g), factory.intLiteral(1))),
                log(factory.access(g)),
                log(factory.access(v)),
                log(factory.access(p)),
                log(factory.access(factory.access(a), f))));
        return m;
    }

    @DisplayName("fields accessed once are not tracked")
    @Test
    public void test1() {
        VariableAccesses va = new SourceVariableResolver().resolve(fieldsAndProperties());
        assertEquals("a, this.f, this.g, this.v, this.p, a.f", print(va.sourceVariables()));
        assertEquals("a, this.g", print(va.tracked()));
        assertEquals("parameter a, assignment this.g", va.writes().stream().map(Object::toString)
                .collect(Collectors.joining(", ")));
        // the qualifier a is read as well
        assertEquals(6, va.reads().size());
        SourceVariable af = va.sourceVariables().stream().filter(sv -> sv.depth() == 1).findFirst().orElseThrow();
        assertInstanceOf(SourceVariable.QualifiedFieldOrProp.class, af);
        assertEquals("a", ((SourceVariable.QualifiedFieldOrProp) af).qualifier().toString());
        assertTrue(va.isRead(af));
        assertFalse(va.isWritten(af));
    }

    @DisplayName("track all fields and properties, except volatile fields and non-field-like properties")
    @Test
    public void test2() {
        VariableAccesses va = new SourceVariableResolver(true).resolve(fieldsAndProperties());
        assertEquals("a, this.f, this.g, a.f", print(va.tracked()));
    }

    @DisplayName("a field accessed once inside a loop is tracked")
    @Test
    public void test3() {
        LocalVariable i = factory.newLocalVariable("i", factory.intType());
        MethodInfo m = factory.newMethod(X, "m");
        m.setBody(factory.block(
                factory.declare(i, factory.intLiteral(0)),
                factory.whileStatement(factory.binary(factory.access(i), BinaryOperation.Operator.LESS,
                        factory.access(f)), factory.statement(factory.increment(factory.access(i))))));
        VariableAccesses va = new SourceVariableResolver().resolve(m);
        assertEquals("i, this.f", print(va.tracked()));
    }

    @DisplayName("ref and out arguments are written at the call")
    @Test
    public void test4() {
        MethodInfo refOut = factory.newMethod(X, "refOut",
                factory.newParameter(0, "p", factory.intType(), ParameterMode.REF),
                factory.newParameter(1, "q", factory.intType(), ParameterMode.OUT));
        LocalVariable y = factory.newLocalVariable("y", factory.intType());
        LocalVariable z = factory.newLocalVariable("z", factory.intType());
        MethodInfo m = factory.newMethod(X, "m");
        MethodCall call = factory.call(refOut, factory.access(y), factory.access(z));
        m.setBody(factory.block(
                factory.declare(y, factory.intLiteral(0)),
                factory.declare(z, null),
                factory.statement(call)));
        VariableAccesses va = new SourceVariableResolver().resolve(m);
        assertEquals("declaration y, ref_argument y, out_argument z", va.writes().stream()
                .map(Object::toString).collect(Collectors.joining(", ")));
        assertSame(call, va.writes().get(1).element());
        assertFalse(va.writes().get(1).isCertain());
        assertTrue(va.writes().get(2).isCertain());
        // y is read before the call, z is not
        assertEquals("y@y", va.reads().stream().map(Object::toString).collect(Collectors.joining(", ")));
    }

    @DisplayName("variables of the enclosing callable are captured in a lambda")
    @Test
    public void test5() {
        LocalVariable x = factory.newLocalVariable("x", factory.intType());
        MethodInfo m = factory.newMethod(X, "m");
        LambdaInfo li = factory.newLambdaInfo(m);
        li.setBody(factory.block(log(factory.access(x))));
        m.setBody(factory.block(
                factory.declare(x, factory.intLiteral(3)),
                factory.statement(factory.lambda(li))));
        SourceVariableResolver resolver = new SourceVariableResolver();
        VariableAccesses inM = resolver.resolve(m);
        assertEquals(1, inM.lambdas().size());
        assertFalse(inM.sourceVariables().iterator().next().isCaptured());

        VariableAccesses inLambda = resolver.resolve(li);
        SourceVariable captured = inLambda.sourceVariables().iterator().next();
        assertTrue(captured.isCaptured());
        assertSame(m, resolver.declaringCallable(li, x));
        assertTrue(resolver.declaredIn(m).contains(x));
        assertFalse(resolver.declaredIn(li).contains(x));
    }

    @DisplayName("a qualifier accessed once is counted once")
    @Test
    public void test6() {
        FieldInfo a = factory.newField(X, "a", X);
        FieldInfo b = factory.newField(X, "b", factory.intType());
        MethodInfo m = factory.newMethod(X, "m");
        m.setBody(factory.block(log(factory.access(factory.access(a), b))));
        VariableAccesses va = new SourceVariableResolver().resolve(m);
        assertEquals("this.a, this.a.b", print(va.sourceVariables()));
        assertEquals("", print(va.tracked()));

        MethodInfo n = factory.newMethod(X, "n");
        n.setBody(factory.block(
                log(factory.access(factory.access(a), b)),
                log(factory.access(factory.access(a), b))));
        VariableAccesses va2 = new SourceVariableResolver().resolve(n);
        assertEquals("this.a, this.a.b", print(va2.tracked()));
    }
}
