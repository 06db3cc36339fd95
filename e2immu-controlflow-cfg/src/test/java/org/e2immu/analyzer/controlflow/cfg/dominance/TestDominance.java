package org.e2immu.analyzer.controlflow.cfg.dominance;

import org.e2immu.analyzer.controlflow.cfg.CommonTest;
import org.e2immu.analyzer.controlflow.cfg.ControlFlowGraph;
import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlocks;
import org.e2immu.analyzer.controlflow.common.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestDominance extends CommonTest {

    private void assertDominanceProperties(ControlFlowGraph cfg, boolean exitReachableFromAll) {
        BasicBlocks basicBlocks = cfg.basicBlocks();
        Dominance dominance = cfg.dominance();
        BasicBlock entry = basicBlocks.entryBlock();
        assertNull(dominance.immediateDominator(entry));
        for (BasicBlock x : basicBlocks.blocks()) {
            assertTrue(dominance.dominates(entry, x), "entry must dominate " + x);
            assertTrue(dominance.dominates(x, x));
            assertFalse(dominance.strictlyDominates(x, x));
            for (BasicBlock y : basicBlocks.blocks()) {
                if (x != y) {
                    assertFalse(dominance.dominates(x, y) && dominance.dominates(y, x),
                            "antisymmetry violated for " + x + ", " + y);
                }
                boolean inFrontier = dominance.dominanceFrontier(x).contains(y);
                boolean expected = y.predecessors().stream().anyMatch(p -> dominance.dominates(x, p))
                                   && !dominance.strictlyDominates(x, y);
                assertEquals(expected, inFrontier, "frontier of " + x + " and " + y);
            }
            BasicBlock idom = dominance.immediateDominator(x);
            if (idom != null) {
                assertTrue(dominance.dominatorTreeChildren(idom).contains(x));
            }
            assertTrue(dominance.iteratedDominanceFrontier(List.of(x)).containsAll(dominance.dominanceFrontier(x)));
            if (exitReachableFromAll) {
                assertTrue(dominance.postDominates(basicBlocks.exitBlock(), x));
            }
        }
        for (ControlFlowNode node : cfg.nodes()) {
            assertTrue(cfg.dominates(cfg.entryNode(), node));
            if (exitReachableFromAll) {
                assertTrue(cfg.postDominates(cfg.exitNode(), node));
            }
        }
    }

    @DisplayName("properties hold for if-else")
    @Test
    public void test1() {
        ParameterInfo c = factory.newParameter(0, "c", factory.boolType());
        MethodInfo m = method("m", c);
        ControlFlowGraph cfg = build(m, factory.ifStatement(factory.access(c), callStatement(a), callStatement(b)),
                callStatement(call));
        assertDominanceProperties(cfg, true);
    }

    @DisplayName("properties hold for nested loops with break and continue")
    @Test
    public void test2() {
        ParameterInfo c = factory.newParameter(0, "c", factory.boolType());
        ParameterInfo d = factory.newParameter(1, "d", factory.boolType());
        MethodInfo m = method("m", c, d);
        Statement inner = factory.whileStatement(factory.access(d), factory.block(
                factory.ifStatement(factory.access(c), new BreakStatement(), new ContinueStatement())));
        ControlFlowGraph cfg = build(m, factory.whileStatement(factory.access(c),
                factory.block(callStatement(a), inner, callStatement(b))));
        assertDominanceProperties(cfg, true);
    }

    @DisplayName("properties hold for try-catch-finally")
    @Test
    public void test3() {
        MethodInfo m = method("m");
        ControlFlowGraph cfg = build(m, factory.tryStatement(factory.block(callStatement(call)),
                factory.block(callStatement(b)), factory.catchClause(factory.invalidCastExceptionType(),
                        callStatement(a))));
        assertDominanceProperties(cfg, true);
        assertNotNull(cfg.exceptionalExitNode());
        assertNotNull(cfg.normalExitNode());
    }

    @DisplayName("infinite loop: no exit, no post-dominance")
    @Test
    public void test4() {
        MethodInfo m = method("m");
        ControlFlowGraph cfg = build(m, factory.whileStatement(factory.boolLiteral(true),
                factory.block(callStatement(a))));
        assertNull(cfg.exitNode());
        assertNull(cfg.basicBlocks().exitBlock());
        assertDominanceProperties(cfg, false);
        BasicBlock entry = cfg.basicBlocks().entryBlock();
        assertNull(cfg.dominance().immediatePostDominator(entry));
    }

    @DisplayName("dominance inside a basic block follows the order of the nodes")
    @Test
    public void test5() {
        LocalVariable x = factory.newLocalVariable("x", factory.intType());
        MethodInfo m = method("m");
        ExpressionStatement s1 = factory.statement(factory.assign(factory.access(x), factory.intLiteral(1)));
        ExpressionStatement s2 = callStatement(log, factory.access(x));
        ControlFlowGraph cfg = build(m, s1, s2);
        ControlFlowNode n1 = node(cfg, s1);
        ControlFlowNode n2 = node(cfg, s2);
        assertSame(cfg.basicBlockOf(n1), cfg.basicBlockOf(n2));
        assertTrue(cfg.dominates(n1, n2));
        assertTrue(cfg.strictlyDominates(n1, n2));
        assertFalse(cfg.dominates(n2, n1));
        assertTrue(cfg.postDominates(n2, n1));
        assertFalse(cfg.strictlyPostDominates(n1, n1));
    }

    @DisplayName("iterated dominance frontier of the two branches of an if inside a loop")
    @Test
    public void test6() {
        ParameterInfo c = factory.newParameter(0, "c", factory.boolType());
        MethodInfo m = method("m", c);
        ExpressionStatement s1 = callStatement(a);
        ExpressionStatement s2 = callStatement(b);
        ExpressionStatement s3 = callStatement(call);
        VariableAccess condition = factory.access(c);
        ControlFlowGraph cfg = build(m, factory.whileStatement(condition,
                factory.block(factory.ifStatement(factory.access(c), s1, s2), s3)));
        BasicBlock b1 = cfg.basicBlockOf(node(cfg, s1));
        BasicBlock b2 = cfg.basicBlockOf(node(cfg, s2));
        BasicBlock join = cfg.basicBlockOf(node(cfg, s3));
        BasicBlock header = cfg.basicBlockOf(node(cfg, condition));
        Set<BasicBlock> idf = cfg.dominance().iteratedDominanceFrontier(List.of(b1, b2));
        assertEquals(List.of(header, join), List.copyOf(idf));
        assertEquals(Set.of(join), cfg.dominance().dominanceFrontier(b1));
    }
}
