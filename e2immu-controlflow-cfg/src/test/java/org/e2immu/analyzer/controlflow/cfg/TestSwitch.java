package org.e2immu.analyzer.controlflow.cfg;

import org.e2immu.analyzer.controlflow.common.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TestSwitch extends CommonTest {

    private SwitchCase switchCase(int value, Statement... statements) {
        return new SwitchCase(new ConstantPattern(factory.intLiteral(value)), null, List.of(statements));
    }

    @DisplayName("empty case falls through, default last")
    @Test
    public void test1() {
        ParameterInfo x = factory.newParameter(0, "x", factory.intType());
        MethodInfo m = method("m", x);
        BreakStatement breakStatement = new BreakStatement();
        SwitchCase case1 = switchCase(1);
        SwitchCase defaultCase = new SwitchCase(null, null, List.of(callStatement(b)));
        SwitchCase case2 = switchCase(2, callStatement(a), breakStatement);
        ExpressionStatement after = callStatement(call);
        ControlFlowGraph cfg = build(m, new SwitchStatement(factory.access(x), List.of(defaultCase, case1, case2)),
                after);

        ControlFlowNode c1 = node(cfg, case1);
        assertEquals("a();", print(cfg.successors(c1, EdgeType.MATCH)));
        assertEquals("case 2:", print(cfg.successors(c1, EdgeType.NO_MATCH)));
        ControlFlowNode c2 = node(cfg, case2);
        assertEquals("default:", print(cfg.successors(c2, EdgeType.NO_MATCH)));
        ControlFlowNode d = node(cfg, defaultCase);
        assertEquals(1, cfg.successors(d).size());
        assertEquals("b();", print(cfg.successors(d, EdgeType.MATCH)));
        assertEquals("call();", print(cfg.successors(node(cfg, breakStatement), EdgeType.BREAK)));
        assertEquals(Set.of("b()", "break;"), cfg.predecessors(node(cfg, after)).stream().map(Object::toString)
                .collect(Collectors.toSet()));
    }

    @DisplayName("no default: the last case can leave the switch")
    @Test
    public void test2() {
        ParameterInfo x = factory.newParameter(0, "x", factory.intType());
        MethodInfo m = method("m", x);
        SwitchCase case1 = switchCase(1, callStatement(a), new BreakStatement());
        ExpressionStatement after = callStatement(call);
        ControlFlowGraph cfg = build(m, new SwitchStatement(factory.access(x), List.of(case1)), after);
        assertEquals("call();", print(cfg.successors(node(cfg, case1), EdgeType.NO_MATCH)));
    }

    @DisplayName("goto case and goto default")
    @Test
    public void test3() {
        ParameterInfo x = factory.newParameter(0, "x", factory.intType());
        MethodInfo m = method("m", x);
        GotoStatement gotoCase = GotoStatement.gotoCase(2);
        GotoStatement gotoDefault = GotoStatement.gotoDefault();
        SwitchCase case1 = switchCase(1, gotoCase);
        SwitchCase case2 = switchCase(2, gotoDefault);
        SwitchCase defaultCase = new SwitchCase(null, null, List.of(callStatement(b)));
        ControlFlowGraph cfg = build(m, new SwitchStatement(factory.access(x), List.of(case1, case2, defaultCase)));
        assertEquals("goto default;", print(cfg.successors(node(cfg, gotoCase), EdgeType.GOTO)));
        assertEquals("b();", print(cfg.successors(node(cfg, gotoDefault), EdgeType.GOTO)));
    }

    @DisplayName("switch expression: the last arm throws when it does not match")
    @Test
    public void test4() {
        ParameterInfo x = factory.newParameter(0, "x", factory.intType());
        LocalVariable y = factory.newLocalVariable("y", factory.intType());
        MethodInfo m = method("m", x);
        Literal ten = factory.intLiteral(10);
        SwitchArm arm1 = new SwitchArm(new ConstantPattern(factory.intLiteral(1)), null, ten);
        SwitchArm arm2 = new SwitchArm(new ConstantPattern(factory.intLiteral(2)), null, factory.intLiteral(20));
        SwitchExpression switchExpression = new SwitchExpression(factory.access(x), List.of(arm1, arm2),
                factory.intType());
        Assignment assignment = factory.assign(factory.access(y), switchExpression);
        ControlFlowGraph cfg = build(m, factory.statement(assignment));

        assertEquals("10", print(cfg.successors(node(cfg, arm1), EdgeType.MATCH)));
        assertEquals(print(List.of(node(cfg, arm2))), print(cfg.successors(node(cfg, arm1), EdgeType.NO_MATCH)));
        assertEquals("exit m (abnormal)", print(cfg.successors(node(cfg, arm2), EdgeType.EXCEPTION)));
        assertEquals(print(List.of(node(cfg, assignment))), print(cfg.successors(node(cfg, ten))));
        assertNotNull(cfg.exceptionalExitNode());
    }
}
