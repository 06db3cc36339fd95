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

public class TestFieldsAndCalls extends CommonTest {

    @DisplayName("field written once in the constructor")
    @Test
    public void test1() {
        FieldInfo f = factory.newField(X, "f", factory.intType());
        MethodInfo constructor = factory.newConstructor(X);
        CallableSsa ssa = ssa(constructor, assign(factory.access(f), factory.intLiteral(1)));
        SourceVariable sf = ssa.sourceVariable("this.f");
        assertFalse(ssa.isTracked(sf));
        List<Definition> definitions = ssa.definitionsOf(sf);
        assertEquals("[def this.f@f = 1]", definitions.toString());
        assertInstanceOf(ExplicitDefinition.class, definitions.get(0));
    }

    @DisplayName("a call to a setter redefines the field")
    @Test
    public void test2() {
        FieldInfo f = factory.newField(X, "f", factory.intType());
        MethodInfo setF = method("setF");
        setF.setBody(factory.block(assign(factory.access(f), factory.intLiteral(2))));
        MethodInfo m = method("m");
        MemberAccess r1 = factory.access(f);
        MemberAccess r2 = factory.access(f);
        CallableSsa ssa = ssa(m, callStatement(log, r1), callStatement(setF), callStatement(log, r2));

        SourceVariable sf = ssa.sourceVariable("this.f");
        assertTrue(ssa.isTracked(sf));
        List<Definition> definitions = ssa.definitionsOf(sf);
        assertEquals("[entry this.f, call this.f@setF()]", definitions.toString());
        Definition entry = definitions.get(0);
        Definition call = definitions.get(1);
        assertInstanceOf(ImplicitEntryDefinition.class, entry);
        assertInstanceOf(ImplicitCallDefinition.class, call);
        assertTrue(entry.isCertain());
        assertFalse(call.isCertain());
        assertTrue(call.isPseudo());
        assertSame(entry, ssa.definitionReaching(single(ssa.readsAt(r1))));
        assertSame(call, ssa.definitionReaching(single(ssa.readsAt(r2))));
        assertSame(entry, call.priorDefinition());
        assertEquals(Set.of(call, entry), call.ultimateDefinitions());
    }

    @DisplayName("call graph edges: intra-instance for calls on this, cross-instance otherwise")
    @Test
    public void test3() {
        ParameterInfo other = factory.newParameter(0, "other", X);
        MethodInfo setF = method("setF");
        setF.setBody(factory.block());
        MethodInfo n = method("n", other);
        n.setBody(factory.block(factory.statement(factory.call(factory.access(other), setF))));
        MethodInfo m = method("m");
        m.setBody(factory.block(callStatement(setF), callStatement(n, factory.newObject(factory.defaultConstructor(X)))));
        ProgramAnalysis analysis = analysis();
        assertEquals("X.m(0)->I->X.n(1), X.m(0)->I->X.setF(0), X.m(0)->X->X.<init>(0), X.n(1)->X->X.setF(0)",
                ComputeCallGraph.print(analysis.callGraph()));
    }

    @DisplayName("qualified field: redefined when the qualifier changes")
    @Test
    public void test4() {
        FieldInfo f = factory.newField(X, "f", factory.intType());
        ParameterInfo a = factory.newParameter(0, "a", X);
        ParameterInfo q = factory.newParameter(1, "q", X);
        MethodInfo m = method("m", a, q);
        MemberAccess r1 = factory.access(factory.access(a), f);
        MemberAccess r2 = factory.access(factory.access(a), f);
        CallableSsa ssa = ssa(m,
                callStatement(log, r1),
                assign(factory.access(a), factory.access(q)),
                callStatement(log, r2));
        SourceVariable af = ssa.sourceVariable("a.f");
        assertTrue(ssa.isTracked(af));
        assertEquals(1, af.depth());
        List<Definition> definitions = ssa.definitionsOf(af);
        assertEquals("[entry a.f, qualifier a.f@a = q]", definitions.toString());
        assertSame(definitions.get(0), ssa.definitionReaching(single(ssa.readsAt(r1))));
        assertSame(definitions.get(1), ssa.definitionReaching(single(ssa.readsAt(r2))));
        assertInstanceOf(ImplicitQualifierDefinition.class, definitions.get(1));
    }

    @DisplayName("pruning the call graph does not change the result")
    @Test
    public void test5() {
        FieldInfo f = factory.newField(X, "f", factory.intType());
        MethodInfo setF = method("setF");
        setF.setBody(factory.block(assign(factory.access(f), factory.intLiteral(2))));
        MethodInfo indirect = method("indirect");
        indirect.setBody(factory.block(callStatement(setF)));
        MethodInfo unrelated = method("unrelated");
        unrelated.setBody(factory.block(callStatement(log, factory.intLiteral(3))));
        MethodInfo m = method("m");
        m.setBody(factory.block(
                callStatement(log, factory.access(f)),
                callStatement(indirect),
                callStatement(unrelated),
                callStatement(log, factory.access(f))));

        ProgramAnalysis pruned = analysis(new ProgramAnalysis.Configuration.Builder().build());
        ProgramAnalysis unpruned = analysis(new ProgramAnalysis.Configuration.Builder()
                .setPruneCallGraph(false).build());
        assertTrue(pruned.configuration().pruneCallGraph());
        String printed = pruned.ssaOf(m).print();
        assertEquals(printed, unpruned.ssaOf(m).print());
        assertEquals("""
                entry this.f -> this.f@f
                call this.f@indirect() -> this.f@f\
                """, printed);
    }

    @DisplayName("volatile fields and non-field-like properties are not tracked")
    @Test
    public void test6() {
        FieldInfo v = factory.newField(X, "v", factory.intType(), false, true);
        PropertyInfo p = factory.newProperty(X, "p", factory.intType(), false, true, true);
        MethodInfo m = method("m");
        CallableSsa ssa = ssa(m,
                callStatement(log, factory.access(v)),
                callStatement(log, factory.access(v)),
                callStatement(log, factory.access(p)),
                callStatement(log, factory.access(p)));
        assertFalse(ssa.isTracked(ssa.sourceVariable("this.v")));
        assertFalse(ssa.isTracked(ssa.sourceVariable("this.p")));
        assertEquals(4, ssa.definitions().size());
        assertTrue(ssa.definitions().stream().allMatch(d -> d instanceof ImplicitUntrackedDefinition));
    }
}
