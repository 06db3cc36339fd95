package org.e2immu.analyzer.controlflow.cfg.impl;

import org.e2immu.analyzer.controlflow.common.ast.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Collections;

/*
The control flow structure of the body of one callable.

Every element has an ordered list of steps: its control flow children, and the element itself at the position
where its own node is evaluated. Statements and the short-circuit operators put themselves first (pre-order),
most expressions last (post-order); object creation and foreach in between.

Children of an element are computed here, once; only elements reachable through the steps get a parent.
Constant expressions have no children: they are evaluated as a single node.
 */
public class ElementStructure {

    public enum Context {VALUE, BOOLEAN, NULLNESS}

    private final Element body;
    private final boolean implicitExceptionsOnlyInTry;
    private final Map<Element, List<Element>> steps = new IdentityHashMap<>();
    private final Map<Element, Element> parents = new IdentityHashMap<>();
    private final Map<Element, Context> contexts = new IdentityHashMap<>();
    private final Map<TryStatement, Integer> finallyNestLevels = new HashMap<>();
    private final Set<Element> mayThrowImplicitly = Collections.newSetFromMap(new IdentityHashMap<>());

    public ElementStructure(Element body, boolean implicitExceptionsOnlyInTry) {
        this.body = body;
        this.implicitExceptionsOnlyInTry = implicitExceptionsOnlyInTry;
        walk(body, Context.VALUE, !implicitExceptionsOnlyInTry, 0);
    }

    private void walk(Element element, Context context, boolean inTry, int finallyDepth) {
        List<Element> list = computeSteps(element);
        steps.put(element, list);
        contexts.put(element, context);
        if (inTry) mayThrowImplicitly.add(element);
        if (element instanceof TryStatement ts) finallyNestLevels.put(ts, finallyDepth);
        for (Element step : list) {
            if (step != element) {
                parents.put(step, element);
                boolean childInTry;
                int childFinallyDepth = finallyDepth;
                if (element instanceof TryStatement ts) {
                    if (step == ts.block()) {
                        childInTry = true;
                    } else if (step instanceof CatchClause) {
                        childInTry = inTry || ts.finallyBlock() != null;
                    } else {
                        childInTry = inTry;
                        childFinallyDepth = finallyDepth + 1;
                    }
                } else {
                    childInTry = inTry;
                }
                walk(step, childContext(element, step, context), childInTry || !implicitExceptionsOnlyInTry,
                        childFinallyDepth);
            }
        }
    }

    private static Context childContext(Element parent, Element child, Context parentContext) {
        if (parent instanceof IfStatement is && child == is.condition()
            || parent instanceof WhileStatement ws && child == ws.condition()
            || parent instanceof DoStatement ds && child == ds.condition()
            || parent instanceof ForStatement fs && child == fs.condition()
            || parent instanceof ConditionalExpression ce && child == ce.condition()
            || parent instanceof CatchClause cc && child == cc.filter()
            || parent instanceof SwitchCase sc && child == sc.guard()
            || parent instanceof SwitchArm sa && child == sa.guard()) {
            return Context.BOOLEAN;
        }
        if (parent instanceof LogicalAnd la) return child == la.lhs() ? Context.BOOLEAN : parentContext;
        if (parent instanceof LogicalOr lo) return child == lo.lhs() ? Context.BOOLEAN : parentContext;
        if (parent instanceof LogicalNot) {
            return parentContext == Context.BOOLEAN ? Context.BOOLEAN : Context.VALUE;
        }
        if (parent instanceof NullCoalescing nc) return child == nc.lhs() ? Context.NULLNESS : parentContext;
        if (parent instanceof ConditionalExpression
            || parent instanceof SwitchExpression se && child != se.selector()
            || parent instanceof SwitchArm) {
            return parentContext;
        }
        return Context.VALUE;
    }

    private static List<Element> computeSteps(Element e) {
        if (e instanceof Expression ex && ex.isConstant()) return List.of(e);
        List<Element> list = new ArrayList<>();
        if (e instanceof Block b) {
            list.add(e);
            list.addAll(b.statements());
        } else if (e instanceof ExpressionStatement es) {
            list.add(e);
            list.add(es.expression());
        } else if (e instanceof LocalDeclarationStatement lds) {
            list.add(e);
            list.addAll(lds.declarations());
        } else if (e instanceof IfStatement is) {
            list.add(e);
            list.add(is.condition());
            list.add(is.thenStatement());
            if (is.elseStatement() != null) list.add(is.elseStatement());
        } else if (e instanceof WhileStatement ws) {
            list.add(e);
            list.add(ws.condition());
            list.add(ws.body());
        } else if (e instanceof DoStatement ds) {
            list.add(e);
            list.add(ds.body());
            list.add(ds.condition());
        } else if (e instanceof ForStatement fs) {
            list.add(e);
            list.addAll(fs.initializers());
            if (fs.condition() != null) list.add(fs.condition());
            list.add(fs.body());
            list.addAll(fs.updaters());
        } else if (e instanceof ForEachStatement fe) {
            list.add(fe.iterable());
            list.add(e);
            list.add(fe.variable());
            list.add(fe.body());
        } else if (e instanceof SwitchStatement ss) {
            list.add(e);
            list.add(ss.selector());
            list.addAll(ss.cases());
        } else if (e instanceof SwitchCase sc) {
            list.add(e);
            if (sc.guard() != null) list.add(sc.guard());
            list.addAll(sc.body());
        } else if (e instanceof ReturnStatement rs) {
            if (rs.expression() != null) list.add(rs.expression());
            list.add(e);
        } else if (e instanceof ThrowStatement ts) {
            if (ts.expression() != null) list.add(ts.expression());
            list.add(e);
        } else if (e instanceof LabeledStatement ls) {
            list.add(e);
            list.add(ls.statement());
        } else if (e instanceof TryStatement ts) {
            list.add(e);
            list.add(ts.block());
            list.addAll(ts.catchClauses());
            if (ts.finallyBlock() != null) list.add(ts.finallyBlock());
        } else if (e instanceof CatchClause cc) {
            list.add(e);
            if (cc.filter() != null) list.add(cc.filter());
            list.add(cc.body());
        } else if (e instanceof LockStatement ls) {
            list.add(ls.lock());
            list.add(e);
            list.add(ls.body());
        } else if (e instanceof MemberAccess ma) {
            if (ma.hasEvaluatedQualifier()) list.add(ma.qualifier());
            list.add(e);
        } else if (e instanceof ArrayAccess aa) {
            list.add(aa.array());
            list.add(aa.index());
            list.add(e);
        } else if (e instanceof Assignment a) {
            if (a.isCompound()) {
                list.add(a.target());
            } else {
                list.addAll(writeTargetParts(a.target()));
            }
            list.add(a.value());
            list.add(e);
        } else if (e instanceof BinaryOperation bo) {
            list.add(bo.lhs());
            list.add(bo.rhs());
            list.add(e);
        } else if (e instanceof UnaryOperation uo) {
            list.add(uo.operand());
            list.add(e);
        } else if (e instanceof LogicalAnd la) {
            list.add(e);
            list.add(la.lhs());
            list.add(la.rhs());
        } else if (e instanceof LogicalOr lo) {
            list.add(e);
            list.add(lo.lhs());
            list.add(lo.rhs());
        } else if (e instanceof LogicalNot ln) {
            list.add(e);
            list.add(ln.operand());
        } else if (e instanceof NullCoalescing nc) {
            list.add(e);
            list.add(nc.lhs());
            list.add(nc.rhs());
        } else if (e instanceof ConditionalExpression ce) {
            list.add(e);
            list.add(ce.condition());
            list.add(ce.ifTrue());
            list.add(ce.ifFalse());
        } else if (e instanceof MethodCall mc) {
            if (mc.hasEvaluatedQualifier()) list.add(mc.qualifier());
            addArguments(mc, list);
            list.add(e);
        } else if (e instanceof DelegateCall dc) {
            list.add(dc.delegate());
            addArguments(dc, list);
            list.add(e);
        } else if (e instanceof ObjectCreation oc) {
            addArguments(oc, list);
            list.add(e);
            list.addAll(oc.initializers());
        } else if (e instanceof MemberInitializer mi) {
            list.add(mi.value());
            list.add(e);
        } else if (e instanceof ArrayCreation ac) {
            list.addAll(ac.dimensions());
            list.addAll(ac.initializers());
            list.add(e);
        } else if (e instanceof ThrowExpression te) {
            list.add(te.exception());
            list.add(e);
        } else if (e instanceof IsPattern ip) {
            list.add(ip.expression());
            list.add(e);
        } else if (e instanceof Cast c) {
            list.add(c.expression());
            list.add(e);
        } else if (e instanceof LocalVariableDeclaration lvd) {
            if (lvd.initializer() != null) list.add(lvd.initializer());
            list.add(e);
        } else if (e instanceof SwitchExpression se) {
            list.add(e);
            list.add(se.selector());
            list.addAll(se.arms());
        } else if (e instanceof SwitchArm sa) {
            list.add(e);
            if (sa.guard() != null) list.add(sa.guard());
            list.add(sa.result());
        } else {
            // leaves, and shapes without control flow children
            list.add(e);
        }
        return List.copyOf(list);
    }

    private static void addArguments(Call call, List<Element> list) {
        List<Expression> arguments = call.arguments();
        for (int i = 0; i < arguments.size(); i++) {
            Expression argument = arguments.get(i);
            if (call.parameterMode(i) == ParameterMode.OUT) {
                list.addAll(writeTargetParts(argument));
            } else {
                list.add(argument);
            }
        }
    }

    /*
    the parts of an assignment target that are evaluated before the value; the write itself happens at the
    assignment (or call) node
     */
    public static List<Element> writeTargetParts(Expression target) {
        if (target instanceof VariableAccess || target instanceof LocalVariableDeclaration) return List.of();
        if (target instanceof MemberAccess ma) {
            return ma.hasEvaluatedQualifier() ? List.of(ma.qualifier()) : List.of();
        }
        if (target instanceof ArrayAccess aa) return List.of(aa.array(), aa.index());
        return List.of(target);
    }

    public Element body() {
        return body;
    }

    public boolean contains(Element element) {
        return steps.containsKey(element);
    }

    public List<Element> steps(Element element) {
        List<Element> list = steps.get(element);
        if (list == null) throw new IllegalArgumentException("Element not in this callable: " + element);
        return list;
    }

    public Element parent(Element element) {
        return parents.get(element);
    }

    public Context context(Element element) {
        return contexts.get(element);
    }

    public int finallyNestLevel(TryStatement tryStatement) {
        return finallyNestLevels.get(tryStatement);
    }

    public boolean mayThrowImplicitly(Element element) {
        return mayThrowImplicitly.contains(element);
    }

    /*
    the first element evaluated when the element starts executing
     */
    public Element first(Element element) {
        Element e = element;
        while (true) {
            Element first = steps(e).get(0);
            if (first == e) return e;
            e = first;
        }
    }

    public int stepIndex(Element parent, Element step) {
        List<Element> list = steps(parent);
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == step) return i;
        }
        throw new IllegalArgumentException(step + " is not a step of " + parent);
    }

    public CatchClause enclosingCatchClause(Element element) {
        for (Element e = parents.get(element); e != null; e = parents.get(e)) {
            if (e instanceof CatchClause cc) return cc;
        }
        return null;
    }
}
