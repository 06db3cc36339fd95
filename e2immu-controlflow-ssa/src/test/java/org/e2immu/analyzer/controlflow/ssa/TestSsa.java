package org.e2immu.analyzer.controlflow.ssa;

import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.common.ast.*;
import org.e2immu.analyzer.controlflow.ssa.definition.*;
import org.e2immu.analyzer.controlflow.ssa.variable.AssignableDefinition;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestSsa extends CommonTest {

    @DisplayName("straight line: each read sees the last write")
    @Test
    public void test1() {
        LocalVariable x = local("x");
        MethodInfo m = method("m");
        VariableAccess r1 = factory.access(x);
        VariableAccess r2 = factory.access(x);
        CallableSsa ssa = ssa(m,
                assign(factory.access(x), factory.intLiteral(1)),
                callStatement(log, r1),
                assign(factory.access(x), factory.intLiteral(2)),
                callStatement(log, r2));
        SourceVariable sx = ssa.sourceVariable("x");
        assertTrue(ssa.isTracked(sx));
        List<Definition> definitions = ssa.definitionsOf(sx);
        assertEquals(2, definitions.size());
        Definition d1 = definitions.get(0);
        Definition d2 = definitions.get(1);
        assertEquals("def x@x = 1", d1.toString());
        assertEquals("def x@x = 2", d2.toString());
        ExplicitDefinition e1 = assertInstanceOf(ExplicitDefinition.class, d1);
        assertEquals(AssignableDefinition.Kind.ASSIGNMENT, e1.assignableDefinition().kind());
        assertTrue(d1.isCertain());
        assertFalse(d1.isPseudo());
        assertNull(d1.priorDefinition());

        Read read1 = single(ssa.readsAt(r1));
        Read read2 = single(ssa.readsAt(r2));
        assertSame(d1, ssa.definitionReaching(read1));
        assertSame(d2, ssa.definitionReaching(read2));
        assertEquals(List.of(read1), d1.reads());
        assertEquals(List.of(read1), d1.firstReads());
        assertEquals(List.of(read1), d1.lastReads());
        assertEquals(Set.of(d1), d1.ultimateDefinitions());
        assertEquals("""
                def x@x = 1 -> x@x
                def x@x = 2 -> x@x\
                """, ssa.print());
    }

    @DisplayName("dead stores do not produce definitions")
    @Test
    public void test2() {
        LocalVariable x = local("x");
        LocalVariable y = local("y");
        MethodInfo m = method("m");
        CallableSsa ssa = ssa(m,
                assign(factory.access(x), factory.intLiteral(1)),
                assign(factory.access(y), factory.intLiteral(5)),
                assign(factory.access(x), factory.intLiteral(2)),
                callStatement(log, factory.access(x)),
                assign(factory.access(x), factory.intLiteral(3)));
        SourceVariable sx = ssa.sourceVariable("x");
        SourceVariable sy = ssa.sourceVariable("y");
        assertTrue(ssa.isTracked(sy));
        assertTrue(ssa.definitionsOf(sy).isEmpty());
        assertEquals("[def x@x = 2]", ssa.definitionsOf(sx).toString());
    }

    @DisplayName("if without else: phi node in the join block")
    @Test
    public void test3() {
        ParameterInfo c = factory.newParameter(0, "c", factory.boolType());
        LocalVariable x = local("x");
        MethodInfo m = method("m", c);
        VariableAccess read = factory.access(x);
        CallableSsa ssa = ssa(m,
                assign(factory.access(x), factory.intLiteral(1)),
                factory.ifStatement(factory.access(c), assign(factory.access(x), factory.intLiteral(2))),
                callStatement(log, read));
        SourceVariable sx = ssa.sourceVariable("x");
        List<Definition> definitions = ssa.definitionsOf(sx);
        assertEquals(3, definitions.size());
        Definition d1 = definitions.get(0);
        assertEquals("def x@x = 1", d1.toString());
        Definition d2 = definitions.stream().filter(d -> "def x@x = 2".equals(d.toString())).findFirst()
                .orElseThrow();
        PhiNode phi = definitions.stream().filter(d -> d instanceof PhiNode).map(d -> (PhiNode) d).findFirst()
                .orElseThrow();
        assertTrue(phi.isPseudo());
        assertEquals("phi x@B2", phi.toString());
        assertSame(phi, ssa.definitionReaching(single(ssa.readsAt(read))));
        assertEquals(Set.of(d1, d2), Set.copyOf(phi.inputs()));
        assertEquals(Set.of(d1, d2), phi.ultimateDefinitions());

        BasicBlock b0 = ssa.controlFlowGraph().basicBlocks().entryBlock();
        assertTrue(d1.isLiveAtEndOfBlock(b0));
        assertFalse(d2.isLiveAtEndOfBlock(b0));

        SourceVariable sc = ssa.sourceVariable("c");
        List<Definition> cDefinitions = ssa.definitionsOf(sc);
        assertEquals("[def c@enter m]", cDefinitions.toString());
        ExplicitDefinition cd = (ExplicitDefinition) cDefinitions.get(0);
        assertEquals(AssignableDefinition.Kind.PARAMETER, cd.assignableDefinition().kind());
    }

    @DisplayName("while loop: phi node at the loop header")
    @Test
    public void test4() {
        LocalVariable i = local("i");
        MethodInfo m = method("m");
        VariableAccess inCondition = factory.access(i);
        VariableAccess inBody = factory.access(i);
        VariableAccess after = factory.access(i);
        Expression condition = factory.binary(inCondition, BinaryOperation.Operator.LESS, factory.intLiteral(10));
        Expression increment = factory.binary(inBody, BinaryOperation.Operator.ADD, factory.intLiteral(1));
        CallableSsa ssa = ssa(m,
                assign(factory.access(i), factory.intLiteral(0)),
                factory.whileStatement(condition, factory.block(assign(factory.access(i), increment))),
                callStatement(log, after));
        assertEquals("""
                B0: enter m; {...}; i = 0;; 0; i = 0; while (i < 10) ... -> B1
                B1: i; 10; i < 10 -> B2, B3
                B2: {...}; i = i + 1;; i; 1; i + 1; i = i + 1 -> B1
                B3: log(i);; i; log(i); exit m (normal); exit m\
                """, ssa.controlFlowGraph().basicBlocks().print());
        SourceVariable si = ssa.sourceVariable("i");
        List<Definition> definitions = ssa.definitionsOf(si);
        assertEquals("[def i@i = 0, phi i@B1, def i@i = i + 1]", definitions.toString());
        PhiNode phi = (PhiNode) definitions.get(1);
        Read conditionRead = single(ssa.readsAt(inCondition));
        Read bodyRead = single(ssa.readsAt(inBody));
        Read afterRead = single(ssa.readsAt(after));
        assertEquals(List.of(conditionRead, bodyRead, afterRead), phi.reads());
        assertEquals(List.of(conditionRead), phi.firstReads());
        assertEquals(List.of(bodyRead, afterRead), phi.lastReads());
        assertEquals(Set.of(definitions.get(0), definitions.get(2)), Set.copyOf(phi.inputs()));

        List<BasicBlock> blocks = ssa.controlFlowGraph().basicBlocks().blocks();
        assertTrue(ssa.liveness().liveAtEntry(blocks.get(1), si));
        assertTrue(ssa.liveness().liveAtExit(blocks.get(2), si));
        assertFalse(ssa.liveness().liveAtExit(blocks.get(3), si));
        assertFalse(ssa.liveness().liveAtEntry(blocks.get(0), si));
    }

    @DisplayName("untracked field: every read has its own definition")
    @Test
    public void test5() {
        FieldInfo f = factory.newField(X, "f", factory.intType());
        MethodInfo m = method("m");
        MemberAccess read = factory.access(f);
        CallableSsa ssa = ssa(m, callStatement(log, read));
        SourceVariable sf = ssa.sourceVariable("this.f");
        assertFalse(ssa.isTracked(sf));
        Definition d = ssa.definitionReaching(single(ssa.readsAt(read)));
        assertInstanceOf(ImplicitUntrackedDefinition.class, d);
        assertEquals("untracked this.f@f", d.toString());
        assertEquals(List.of(d), ssa.definitionsOf(sf));
        Read r = single(ssa.readsAt(read));
        assertEquals(List.of(r), d.reads());
        assertEquals(List.of(r), d.firstReads());
        assertEquals(List.of(r), d.lastReads());
    }

    @DisplayName("duplicate out arguments collapse into one uncertain definition")
    @Test
    public void test6() {
        ParameterInfo o1 = factory.newParameter(0, "o1", factory.intType(), ParameterMode.OUT);
        ParameterInfo o2 = factory.newParameter(1, "o2", factory.intType(), ParameterMode.OUT);
        MethodInfo twice = method("twice", o1, o2);
        LocalVariable x = local("x");
        MethodInfo m = method("m");
        MethodCall call = factory.call(twice, factory.access(x), factory.access(x));
        VariableAccess read = factory.access(x);
        CallableSsa ssa = ssa(m,
                assign(factory.access(x), factory.intLiteral(0)),
                factory.statement(call),
                callStatement(log, read));
        List<Definition> definitions = ssa.definitionsOf(ssa.sourceVariable("x"));
        assertEquals("[def x@x = 0, def x@twice(x, x)]", definitions.toString());
        ExplicitDefinition d = (ExplicitDefinition) definitions.get(1);
        assertEquals(2, d.assignableDefinitions().size());
        assertEquals(AssignableDefinition.Kind.OUT_ARGUMENT, d.assignableDefinition().kind());
        assertFalse(d.isCertain());
        assertSame(definitions.get(0), d.priorDefinition());
        assertEquals(Set.of(d, definitions.get(0)), d.ultimateDefinitions());
        assertSame(d, ssa.definitionReaching(single(ssa.readsAt(read))));
    }

    @DisplayName("if-else: the phi node merges the definitions of both branches")
    @Test
    public void test7() {
        ParameterInfo c = factory.newParameter(0, "c", factory.boolType());
        LocalVariable x = local("x");
        MethodInfo m = method("m", c);
        VariableAccess read = factory.access(x);
        CallableSsa ssa = ssa(m,
                factory.ifStatement(factory.access(c),
                        assign(factory.access(x), factory.intLiteral(1)),
                        assign(factory.access(x), factory.intLiteral(2))),
                callStatement(log, read));
        List<Definition> definitions = ssa.definitionsOf(ssa.sourceVariable("x"));
        assertEquals(3, definitions.size());
        Definition d1 = definitions.stream().filter(d -> "def x@x = 1".equals(d.toString())).findFirst()
                .orElseThrow();
        Definition d2 = definitions.stream().filter(d -> "def x@x = 2".equals(d.toString())).findFirst()
                .orElseThrow();
        PhiNode phi = definitions.stream().filter(d -> d instanceof PhiNode).map(d -> (PhiNode) d).findFirst()
                .orElseThrow();
        assertEquals("phi x@B3", phi.toString());
        assertEquals(Set.of(d1, d2), Set.copyOf(phi.inputs()));
        assertEquals(2, phi.inputs().size());
        assertEquals(Set.of(d1, d2), phi.ultimateDefinitions());

        Read r = single(ssa.readsAt(read));
        assertSame(phi, ssa.definitionReaching(r));
        assertEquals(List.of(r), phi.firstReads());
        assertTrue(d1.reads().isEmpty());
        assertTrue(d2.firstReads().isEmpty());
        assertTrue(d1.isLiveAtEndOfBlock(ssa.controlFlowGraph().basicBlockOf(d1.node())));
    }
}
