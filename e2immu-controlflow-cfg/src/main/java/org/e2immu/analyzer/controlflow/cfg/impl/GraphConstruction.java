package org.e2immu.analyzer.controlflow.cfg.impl;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowGraph;
import org.e2immu.analyzer.controlflow.cfg.ControlFlowNode;
import org.e2immu.analyzer.controlflow.cfg.Edge;
import org.e2immu.analyzer.controlflow.cfg.EdgeType;
import org.e2immu.analyzer.controlflow.cfg.Last;
import org.e2immu.analyzer.controlflow.cfg.completion.Completion;
import org.e2immu.analyzer.controlflow.cfg.split.ExceptionHandlerSplit;
import org.e2immu.analyzer.controlflow.cfg.split.FinallySplit;
import org.e2immu.analyzer.controlflow.cfg.split.Splits;
import org.e2immu.analyzer.controlflow.common.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import org.e2immu.analyzer.controlflow.cfg.impl.ElementStructure.Context;

/*
Computes the nodes and edges of one control flow graph.

Starting from the entry node, each node is evaluated: its own completions are computed, and each completion is
propagated upwards through the parents of the element, until a parent decides where execution continues (an edge
to the first element of some step, with possibly different splits) or the body of the callable completes (an edge
to one of the exits). Nodes are created when they are first targeted, so that only reachable nodes exist.

The type of an edge is that of the completion of the source node, unless the completion that reaches the target
is abrupt, e.g. when a finally block resumes a return.
 */
public class GraphConstruction {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphConstruction.class);

    private final Callable callable;
    private final ElementStructure structure;
    private final Factory factory;

    private final Map<ControlFlowNode, Integer> nodeIndices = new LinkedHashMap<>();
    private final Set<Edge> edges = new LinkedHashSet<>();
    private final Map<Element, Set<Last>> lasts = new IdentityHashMap<>();
    private final Deque<ControlFlowNode> toDo = new ArrayDeque<>();
    private final ControlFlowNode.EntryNode entryNode;
    private final ControlFlowNode.ExitNode exitNode;
    private final ControlFlowNode.AnnotatedExitNode normalExitNode;
    private final ControlFlowNode.AnnotatedExitNode exceptionalExitNode;

    /*
    the node being evaluated, and the completion with which it completes
     */
    private record Origin(ControlFlowNode node, Completion own) {
    }

    public GraphConstruction(Callable callable, ElementStructure structure, Factory factory) {
        this.callable = callable;
        this.structure = structure;
        this.factory = factory;
        entryNode = new ControlFlowNode.EntryNode(callable);
        exitNode = new ControlFlowNode.ExitNode(callable);
        normalExitNode = new ControlFlowNode.AnnotatedExitNode(callable, true);
        exceptionalExitNode = new ControlFlowNode.AnnotatedExitNode(callable, false);
    }

    public ControlFlowGraph build() {
        register(entryNode);
        ControlFlowNode first = new ControlFlowNode.ElementNode(callable, structure.first(structure.body()),
                Splits.EMPTY);
        addEdge(entryNode, first, EdgeType.NORMAL);
        while (!toDo.isEmpty()) {
            ControlFlowNode node = toDo.poll();
            if (node instanceof ControlFlowNode.ElementNode en) {
                for (Completion completion : ownCompletions(en.element(), en.splits())) {
                    afterSelf(en.element(), completion, en.splits(), new Origin(en, completion));
                }
            } else if (node instanceof ControlFlowNode.AnnotatedExitNode) {
                addEdge(node, exitNode, EdgeType.NORMAL);
            }
        }
        return new ControlFlowGraphImpl(callable, structure, List.copyOf(nodeIndices.keySet()),
                List.copyOf(edges), lasts, entryNode,
                nodeIndices.containsKey(exitNode) ? exitNode : null,
                nodeIndices.containsKey(normalExitNode) ? normalExitNode : null,
                nodeIndices.containsKey(exceptionalExitNode) ? exceptionalExitNode : null);
    }

    private void register(ControlFlowNode node) {
        if (!nodeIndices.containsKey(node)) {
            nodeIndices.put(node, nodeIndices.size());
            toDo.add(node);
        }
    }

    private void addEdge(ControlFlowNode from, ControlFlowNode to, EdgeType edgeType) {
        register(to);
        edges.add(new Edge(from, to, edgeType));
    }

    // ---------------------------------------------------------------- completions of the node itself

    private List<Completion> ownCompletions(Element e, Splits splits) {
        if (e instanceof BreakStatement) return List.of(Completion.BREAK);
        if (e instanceof ContinueStatement) return List.of(Completion.CONTINUE);
        if (e instanceof ReturnStatement) return List.of(Completion.RETURN);
        if (e instanceof GotoStatement gs) {
            return List.of(switch (gs.kind()) {
                case LABEL -> new Completion.GotoLabel(gs.label());
                case CASE -> new Completion.GotoCase(gs.caseValue());
                case DEFAULT -> Completion.GOTO_DEFAULT;
            });
        }
        if (e instanceof ThrowStatement ts) {
            return List.of(new Completion.Throw(ts.expression() == null ? rethrowType(ts)
                    : ts.expression().type()));
        }
        if (e instanceof ForEachStatement) return List.of(Completion.EMPTY, Completion.NON_EMPTY);
        if (e instanceof CatchClause cc) return catchClauseMatches(cc, splits);
        if (e instanceof SwitchCase sc) {
            return sc.isDefault() || sc.pattern().alwaysMatches() ? List.of(Completion.MATCH)
                    : List.of(Completion.MATCH, Completion.NO_MATCH);
        }
        if (e instanceof SwitchArm sa) {
            return sa.pattern().alwaysMatches() ? List.of(Completion.MATCH)
                    : List.of(Completion.MATCH, Completion.NO_MATCH);
        }
        if (e instanceof ThrowExpression te) return List.of(new Completion.Throw(te.exception().type()));
        if (e instanceof Expression ex && !isPreOrder(ex)) {
            List<Completion> list = new ArrayList<>(valueCompletions(ex));
            TypeInfo implicit = implicitExceptionType(ex);
            if (implicit != null) list.add(new Completion.Throw(implicit));
            return list;
        }
        return List.of(Completion.NORMAL);
    }

    private boolean isPreOrder(Expression expression) {
        List<Element> steps = structure.steps(expression);
        return steps.size() > 1 && steps.get(0) == expression;
    }

    private TypeInfo rethrowType(ThrowStatement throwStatement) {
        CatchClause cc = structure.enclosingCatchClause(throwStatement);
        return cc == null || cc.isGeneral() ? factory.exceptionType() : cc.exceptionType();
    }

    /*
    a general clause, or a clause of a supertype, certainly matches; unrelated types certainly do not match;
    when the clause type is a subtype of the exception type, both are possible
     */
    private List<Completion> catchClauseMatches(CatchClause cc, Splits splits) {
        if (cc.isGeneral()) return List.of(Completion.MATCH);
        ExceptionHandlerSplit ehs = splits.exceptionHandlerSplit();
        if (ehs == null) return List.of(Completion.MATCH, Completion.NO_MATCH);
        TypeInfo thrown = ehs.exceptionType();
        if (thrown.isSubtypeOf(cc.exceptionType())) return List.of(Completion.MATCH);
        if (cc.exceptionType().isSubtypeOf(thrown)) return List.of(Completion.MATCH, Completion.NO_MATCH);
        return List.of(Completion.NO_MATCH);
    }

    private List<Completion> valueCompletions(Expression e) {
        Context context = structure.context(e);
        if (context == Context.BOOLEAN) {
            if (e.isConstant() && e.constantValue() instanceof java.lang.Boolean b) {
                return List.of(b ? Completion.TRUE : Completion.FALSE);
            }
            return List.of(Completion.TRUE, Completion.FALSE);
        }
        if (context == Context.NULLNESS) {
            if (e.isConstant()) return List.of(e.constantValue() == null ? Completion.NULL : Completion.NOT_NULL);
            if (e instanceof ObjectCreation || e instanceof ArrayCreation || e instanceof Lambda) {
                return List.of(Completion.NOT_NULL);
            }
            return List.of(Completion.NULL, Completion.NOT_NULL);
        }
        return List.of(Completion.NORMAL);
    }

    private TypeInfo implicitExceptionType(Expression e) {
        if (!structure.mayThrowImplicitly(e) || e.isConstant()) return null;
        if (e instanceof Call) return factory.exceptionType();
        if (e instanceof Cast cast && !cast.isSafe()) return factory.invalidCastExceptionType();
        if (e instanceof BinaryOperation bo && bo.isIntegralDivision()) return factory.divideByZeroExceptionType();
        if (e instanceof Assignment a && a.isCompound() && a.operator().isDivision() && a.type().isIntegral()) {
            return factory.divideByZeroExceptionType();
        }
        if (e instanceof ArrayAccess) return factory.indexOutOfRangeExceptionType();
        return null;
    }

    // ---------------------------------------------------------------- propagation

    private void goTo(Element target, Splits splits, Completion current, Origin origin) {
        goToNode(structure.first(target), splits, current, origin);
    }

    private void goToNode(Element element, Splits splits, Completion current, Origin origin) {
        ControlFlowNode to = new ControlFlowNode.ElementNode(callable, element, splits);
        addEdge(origin.node(), to, edgeType(current, origin));
    }

    private static EdgeType edgeType(Completion current, Origin origin) {
        if (!current.isNormal() || current instanceof Completion.BreakNormal) return current.edgeType();
        return origin.own().edgeType();
    }

    private void finish(Element e, Completion completion, Splits splits, Origin origin) {
        lasts.computeIfAbsent(e, k -> new LinkedHashSet<>()).add(new Last(origin.node().element(), completion));
        Element parent = structure.parent(e);
        if (parent == null) {
            exit(completion, origin);
        } else {
            afterChild(parent, e, completion, splits, origin);
        }
    }

    private void exit(Completion completion, Origin origin) {
        ControlFlowNode target;
        if (completion instanceof Completion.Throw) {
            target = exceptionalExitNode;
        } else if (completion.isNormal() || completion instanceof Completion.Return) {
            target = normalExitNode;
        } else {
            LOGGER.debug("Dropping unresolved jump {} from {} in {}", completion, origin.node(),
                    callable.fullyQualifiedName());
            return;
        }
        addEdge(origin.node(), target, edgeType(completion, origin));
    }

    /*
    continue with the step after position 'index' of e, or finish e
     */
    private void nextStep(Element e, int index, Completion c, Splits s, Origin o) {
        if (!c.isNormal()) {
            finish(e, c, s, o);
            return;
        }
        List<Element> steps = structure.steps(e);
        if (index + 1 < steps.size()) {
            Element next = steps.get(index + 1);
            if (next == e) {
                goToNode(e, s, c, o);
            } else {
                goTo(next, s, c, o);
            }
        } else {
            finish(e, c, s, o);
        }
    }

    private void afterSelf(Element e, Completion c, Splits s, Origin o) {
        if (e instanceof CatchClause cc) {
            if (c.equals(Completion.MATCH)) {
                if (cc.filter() != null) goTo(cc.filter(), s, c, o);
                else goTo(cc.body(), s.withoutExceptionHandler(), c, o);
            } else {
                noMatchingCatchClause(cc, c, s, o);
            }
        } else if (e instanceof SwitchCase sc) {
            if (c.equals(Completion.MATCH)) {
                if (sc.guard() != null) goTo(sc.guard(), s, c, o);
                else startCaseBody(sc, c, s, o);
            } else {
                noMatchingCase(sc, c, s, o);
            }
        } else if (e instanceof SwitchArm sa) {
            if (c.equals(Completion.MATCH)) {
                goTo(sa.guard() != null ? sa.guard() : sa.result(), s, c, o);
            } else {
                noMatchingArm(sa, c, s, o);
            }
        } else if (e instanceof ForEachStatement fe) {
            if (c.equals(Completion.EMPTY)) finish(fe, Completion.NORMAL, s, o);
            else goTo(fe.variable(), s, c, o);
        } else {
            nextStep(e, structure.stepIndex(e, e), c, s, o);
        }
    }

    private void afterChild(Element e, Element child, Completion c, Splits s, Origin o) {
        if (e instanceof IfStatement is) {
            if (child == is.condition()) {
                onCondition(c, () -> goTo(is.thenStatement(), s, c, o), () -> {
                    if (is.elseStatement() != null) goTo(is.elseStatement(), s, c, o);
                    else finish(is, Completion.NORMAL, s, o);
                }, () -> finish(is, c, s, o));
            } else {
                finish(is, c, s, o);
            }
        } else if (e instanceof WhileStatement ws) {
            if (child == ws.condition()) {
                onCondition(c, () -> goTo(ws.body(), s, c, o), () -> finish(ws, Completion.NORMAL, s, o),
                        () -> finish(ws, c, s, o));
            } else {
                afterLoopBody(ws, c, s, o, () -> goTo(ws.condition(), s, c, o));
            }
        } else if (e instanceof DoStatement ds) {
            if (child == ds.condition()) {
                onCondition(c, () -> goTo(ds.body(), s, c, o), () -> finish(ds, Completion.NORMAL, s, o),
                        () -> finish(ds, c, s, o));
            } else {
                afterLoopBody(ds, c, s, o, () -> goTo(ds.condition(), s, c, o));
            }
        } else if (e instanceof ForStatement fs) {
            afterForChild(fs, child, c, s, o);
        } else if (e instanceof ForEachStatement fe) {
            if (child == fe.iterable()) {
                if (c.isNormal()) goToNode(fe, s, c, o);
                else finish(fe, c, s, o);
            } else if (child == fe.variable()) {
                nextStep(fe, structure.stepIndex(fe, child), c, s, o);
            } else {
                afterLoopBody(fe, c, s, o, () -> goToNode(fe, s, c, o));
            }
        } else if (e instanceof SwitchStatement ss) {
            afterSwitchChild(ss, child, c, s, o);
        } else if (e instanceof SwitchCase sc) {
            if (child == sc.guard()) {
                onCondition(c, () -> startCaseBody(sc, c, s, o), () -> noMatchingCase(sc, c, s, o),
                        () -> finish(sc, c, s, o));
            } else {
                nextStep(sc, structure.stepIndex(sc, child), c, s, o);
            }
        } else if (e instanceof SwitchExpression se) {
            if (child == se.selector()) {
                if (!c.isNormal()) finish(se, c, s, o);
                else if (se.arms().isEmpty()) {
                    finish(se, new Completion.Throw(factory.invalidOperationExceptionType()), s, o);
                } else goTo(se.arms().get(0), s, c, o);
            } else {
                finish(se, c, s, o);
            }
        } else if (e instanceof SwitchArm sa) {
            if (child == sa.guard()) {
                onCondition(c, () -> goTo(sa.result(), s, c, o), () -> noMatchingArm(sa, c, s, o),
                        () -> finish(sa, c, s, o));
            } else {
                finish(sa, c, s, o);
            }
        } else if (e instanceof Block block) {
            LabeledStatement target = c instanceof Completion.GotoLabel gl ? findLabel(block, gl.label()) : null;
            if (target != null) {
                goTo(target, s, c, o);
            } else {
                nextStep(block, structure.stepIndex(block, child), c, s, o);
            }
        } else if (e instanceof TryStatement ts) {
            afterTryChild(ts, child, c, s, o);
        } else if (e instanceof CatchClause cc) {
            if (child == cc.filter()) {
                if (c.equals(Completion.TRUE)) {
                    goTo(cc.body(), s.withoutExceptionHandler(), c, o);
                } else if (c.equals(Completion.FALSE) || c instanceof Completion.Throw) {
                    noMatchingCatchClause(cc, c, s, o);
                } else {
                    goTo(cc.body(), s.withoutExceptionHandler(), c, o);
                    noMatchingCatchClause(cc, c, s, o);
                }
            } else {
                finish(cc, c, s, o);
            }
        } else if (e instanceof LogicalAnd la) {
            if (child == la.lhs()) {
                onCondition(c, () -> goTo(la.rhs(), s, c, o), () -> finishWithBoolean(la, false, s, o),
                        () -> finish(la, c, s, o));
            } else {
                finish(la, c, s, o);
            }
        } else if (e instanceof LogicalOr lo) {
            if (child == lo.lhs()) {
                onCondition(c, () -> finishWithBoolean(lo, true, s, o), () -> goTo(lo.rhs(), s, c, o),
                        () -> finish(lo, c, s, o));
            } else {
                finish(lo, c, s, o);
            }
        } else if (e instanceof LogicalNot ln) {
            if (c instanceof Completion.Boolean b) {
                finishWithBoolean(ln, !b.value(), s, o);
            } else if (c.isNormal() && structure.context(ln) == Context.BOOLEAN) {
                finishWithBoolean(ln, true, s, o);
                finishWithBoolean(ln, false, s, o);
            } else {
                finish(ln, c.isNormal() ? nonNullValue(ln) : c, s, o);
            }
        } else if (e instanceof NullCoalescing nc) {
            if (child == nc.lhs()) {
                if (!c.isNormal()) {
                    finish(nc, c, s, o);
                } else {
                    if (!c.equals(Completion.NOT_NULL)) goTo(nc.rhs(), s, c, o);
                    if (!c.equals(Completion.NULL)) finishWithUnknownValue(nc, s, o);
                }
            } else {
                finish(nc, c, s, o);
            }
        } else if (e instanceof ConditionalExpression ce) {
            if (child == ce.condition()) {
                onCondition(c, () -> goTo(ce.ifTrue(), s, c, o), () -> goTo(ce.ifFalse(), s, c, o),
                        () -> finish(ce, c, s, o));
            } else {
                finish(ce, c, s, o);
            }
        } else {
            nextStep(e, structure.stepIndex(e, child), c, s, o);
        }
    }

    /*
    dispatch on the completion of an element in a boolean context; a plain normal completion means that the
    value is unknown
     */
    private static void onCondition(Completion c, Runnable onTrue, Runnable onFalse, Runnable onAbrupt) {
        if (!c.isNormal()) {
            onAbrupt.run();
        } else {
            if (!c.equals(Completion.FALSE)) onTrue.run();
            if (!c.equals(Completion.TRUE)) onFalse.run();
        }
    }

    private void finishWithBoolean(Expression e, boolean value, Splits s, Origin o) {
        Context context = structure.context(e);
        if (context == Context.BOOLEAN) {
            finish(e, value ? Completion.TRUE : Completion.FALSE, s, o);
        } else {
            finish(e, nonNullValue(e), s, o);
        }
    }

    private Completion nonNullValue(Expression e) {
        return structure.context(e) == Context.NULLNESS ? Completion.NOT_NULL : Completion.NORMAL;
    }

    /*
    a non-null value of which nothing else is known
     */
    private void finishWithUnknownValue(Expression e, Splits s, Origin o) {
        if (structure.context(e) == Context.BOOLEAN) {
            finish(e, Completion.TRUE, s, o);
            finish(e, Completion.FALSE, s, o);
        } else {
            finish(e, nonNullValue(e), s, o);
        }
    }

    // ---------------------------------------------------------------- loops

    private void afterLoopBody(LoopStatement loop, Completion c, Splits s, Origin o, Runnable continueLoop) {
        if (c.isNormal() || c instanceof Completion.Continue) {
            continueLoop.run();
        } else if (c instanceof Completion.Break) {
            finish(loop, Completion.BREAK_NORMAL, s, o);
        } else {
            finish(loop, c, s, o);
        }
    }

    private void afterForChild(ForStatement fs, Element child, Completion c, Splits s, Origin o) {
        int initIndex = indexOf(fs.initializers(), child);
        int updateIndex = indexOf(fs.updaters(), child);
        if (initIndex >= 0) {
            if (!c.isNormal()) finish(fs, c, s, o);
            else if (initIndex + 1 < fs.initializers().size()) goTo(fs.initializers().get(initIndex + 1), s, c, o);
            else forCondition(fs, c, s, o);
        } else if (child == fs.condition()) {
            onCondition(c, () -> goTo(fs.body(), s, c, o), () -> finish(fs, Completion.NORMAL, s, o),
                    () -> finish(fs, c, s, o));
        } else if (updateIndex >= 0) {
            if (!c.isNormal()) finish(fs, c, s, o);
            else if (updateIndex + 1 < fs.updaters().size()) goTo(fs.updaters().get(updateIndex + 1), s, c, o);
            else forCondition(fs, c, s, o);
        } else {
            afterLoopBody(fs, c, s, o, () -> {
                if (fs.updaters().isEmpty()) forCondition(fs, c, s, o);
                else goTo(fs.updaters().get(0), s, c, o);
            });
        }
    }

    private void forCondition(ForStatement fs, Completion c, Splits s, Origin o) {
        goTo(fs.condition() != null ? fs.condition() : fs.body(), s, c, o);
    }

    private static int indexOf(List<? extends Element> list, Element element) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == element) return i;
        }
        return -1;
    }

    // ---------------------------------------------------------------- switch

    private void afterSwitchChild(SwitchStatement ss, Element child, Completion c, Splits s, Origin o) {
        if (child == ss.selector()) {
            if (!c.isNormal()) {
                finish(ss, c, s, o);
            } else {
                List<SwitchCase> cases = ss.casesInEvaluationOrder();
                if (cases.isEmpty()) finish(ss, Completion.NORMAL, s, o);
                else goTo(cases.get(0), s, c, o);
            }
        } else if (c instanceof Completion.Break) {
            finish(ss, Completion.BREAK_NORMAL, s, o);
        } else if (c instanceof Completion.GotoCase gc) {
            SwitchCase target = ss.cases().stream()
                    .filter(sc -> sc.pattern() instanceof ConstantPattern cp && Objects.equals(cp.value(), gc.value()))
                    .findFirst().orElse(null);
            jumpToCase(ss, target, c, s, o);
        } else if (c instanceof Completion.GotoDefault) {
            jumpToCase(ss, ss.defaultCase(), c, s, o);
        } else if (c.isNormal()) {
            finish(ss, Completion.NORMAL, s, o);
        } else {
            finish(ss, c, s, o);
        }
    }

    private void jumpToCase(SwitchStatement ss, SwitchCase target, Completion c, Splits s, Origin o) {
        if (target == null) {
            LOGGER.debug("Dropping unresolved {} in {}", c, ss);
        } else {
            startCaseBody(target, c, s, o);
        }
    }

    /*
    an empty case body falls through to the next case with a body
     */
    private void startCaseBody(SwitchCase sc, Completion c, Splits s, Origin o) {
        SwitchStatement ss = (SwitchStatement) structure.parent(sc);
        List<SwitchCase> cases = ss.cases();
        for (int i = indexOf(cases, sc); i < cases.size(); i++) {
            SwitchCase candidate = cases.get(i);
            if (!candidate.body().isEmpty()) {
                goTo(candidate.body().get(0), s, c, o);
                return;
            }
        }
        finish(sc, Completion.NORMAL, s, o);
    }

    private void noMatchingCase(SwitchCase sc, Completion c, Splits s, Origin o) {
        SwitchStatement ss = (SwitchStatement) structure.parent(sc);
        List<SwitchCase> cases = ss.casesInEvaluationOrder();
        int index = indexOf(cases, sc);
        if (index + 1 < cases.size()) {
            goTo(cases.get(index + 1), s, c, o);
        } else {
            finish(sc, Completion.NO_MATCH, s, o);
        }
    }

    private void noMatchingArm(SwitchArm sa, Completion c, Splits s, Origin o) {
        SwitchExpression se = (SwitchExpression) structure.parent(sa);
        int index = indexOf(se.arms(), sa);
        if (index + 1 < se.arms().size()) {
            goTo(se.arms().get(index + 1), s, c, o);
        } else {
            finish(sa, new Completion.Throw(factory.invalidOperationExceptionType()), s, o);
        }
    }

    private static LabeledStatement findLabel(Block block, String label) {
        for (Statement statement : block.statements()) {
            if (statement instanceof LabeledStatement ls && ls.label().equals(label)) return ls;
        }
        return null;
    }

    // ---------------------------------------------------------------- try, catch, finally

    private void afterTryChild(TryStatement ts, Element child, Completion c, Splits s, Origin o) {
        int level = structure.finallyNestLevel(ts);
        if (child == ts.block()) {
            if (c instanceof Completion.Throw t && !ts.catchClauses().isEmpty()) {
                goTo(ts.catchClauses().get(0), s.with(new ExceptionHandlerSplit(t.exceptionType())), c, o);
            } else {
                leaveTryBlockOrCatchClause(ts, level, c, s, o);
            }
        } else if (child instanceof CatchClause) {
            leaveTryBlockOrCatchClause(ts, level, c, s, o);
        } else {
            // the finally block
            FinallySplit finallySplit = s.finallySplit(level);
            Splits without = s.without(level);
            if (c.isNormal()) {
                Completion resume = finallySplit == null ? Completion.NORMAL : finallySplit.completion();
                finish(ts, resume, without, o);
            } else {
                finish(ts, c, without, o);
            }
        }
    }

    private void leaveTryBlockOrCatchClause(TryStatement ts, int level, Completion c, Splits s, Origin o) {
        if (ts.finallyBlock() != null) {
            goTo(ts.finallyBlock(), s.with(new FinallySplit(c.normalized(), level)), c, o);
        } else {
            finish(ts, c, s, o);
        }
    }

    /*
    try the next catch clause; after the last one, the exception propagates further
     */
    private void noMatchingCatchClause(CatchClause cc, Completion c, Splits s, Origin o) {
        TryStatement ts = (TryStatement) structure.parent(cc);
        int index = indexOf(ts.catchClauses(), cc);
        if (index + 1 < ts.catchClauses().size()) {
            goTo(ts.catchClauses().get(index + 1), s, c, o);
        } else {
            ExceptionHandlerSplit ehs = s.exceptionHandlerSplit();
            TypeInfo exceptionType = ehs == null ? factory.exceptionType() : ehs.exceptionType();
            finish(cc, new Completion.Throw(exceptionType), s.withoutExceptionHandler(), o);
        }
    }
}
