package org.e2immu.analyzer.controlflow.ssa.callgraph;

import org.e2immu.analyzer.controlflow.common.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/*
Flow-insensitive computation of the lambdas that can be held by delegate-valued expressions.

Holders are local variables, parameters, fields and properties, and the return values of callables. Values flow
through assignments, declarations, argument passing, returns, and conditional, null-coalescing and cast expressions.
The computation iterates until no holder receives a new lambda.
 */
public class DelegateFlow {
    private static final Logger LOGGER = LoggerFactory.getLogger(DelegateFlow.class);

    private record ReturnValue(Callable callable) {
    }

    private record Flow(Object holder, Expression source) {
    }

    private final Function<MethodInfo, List<MethodInfo>> dispatch;
    private final Map<Object, Set<LambdaInfo>> values = new HashMap<>();
    private final List<Flow> flows = new ArrayList<>();
    private final List<DelegateCall> delegateCalls = new ArrayList<>();

    public DelegateFlow(Program program, Function<MethodInfo, List<MethodInfo>> dispatch) {
        this.dispatch = dispatch;
        for (Callable callable : program.callables()) {
            collect(callable);
        }
        int iterations = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            iterations++;
            for (Flow flow : flows) {
                changed |= add(flow.holder, lambdas(flow.source));
            }
            for (DelegateCall dc : delegateCalls) {
                for (LambdaInfo li : lambdas(dc.delegate())) {
                    changed |= passArguments(li.parameters(), dc.arguments());
                }
            }
        }
        LOGGER.debug("Delegate flow: {} flows, converged after {} iterations", flows.size(), iterations);
    }

    private boolean add(Object holder, Set<LambdaInfo> lambdas) {
        if (holder == null || lambdas.isEmpty()) return false;
        return values.computeIfAbsent(holder, h -> new LinkedHashSet<>()).addAll(lambdas);
    }

    private boolean passArguments(List<ParameterInfo> parameters, List<Expression> arguments) {
        boolean changed = false;
        for (int i = 0; i < Math.min(parameters.size(), arguments.size()); i++) {
            changed |= add(parameters.get(i), lambdas(arguments.get(i)));
        }
        return changed;
    }

    private void collect(Callable callable) {
        Element body = callable.body();
        if (body instanceof Expression expression) {
            flows.add(new Flow(new ReturnValue(callable), expression));
        }
        body.stream().forEach(e -> {
            if (e instanceof Assignment a && !a.isCompound()) {
                flows.add(new Flow(holder(a.target()), a.value()));
            } else if (e instanceof LocalVariableDeclaration lvd && lvd.initializer() != null) {
                flows.add(new Flow(lvd.variable(), lvd.initializer()));
            } else if (e instanceof ReturnStatement rs && rs.expression() != null) {
                flows.add(new Flow(new ReturnValue(callable), rs.expression()));
            } else if (e instanceof MethodCall mc) {
                for (MethodInfo target : dispatch.apply(mc.method())) {
                    addArgumentFlows(target, mc.arguments());
                }
            } else if (e instanceof ObjectCreation oc) {
                addArgumentFlows(oc.constructor(), oc.arguments());
            } else if (e instanceof DelegateCall dc) {
                delegateCalls.add(dc);
            }
        });
    }

    private void addArgumentFlows(MethodInfo target, List<Expression> arguments) {
        List<ParameterInfo> parameters = target.parameters();
        for (int i = 0; i < Math.min(parameters.size(), arguments.size()); i++) {
            flows.add(new Flow(parameters.get(i), arguments.get(i)));
        }
    }

    private static Object holder(Expression target) {
        if (target instanceof VariableAccess va) return va.variable();
        if (target instanceof MemberAccess ma) return ma.member();
        return null;
    }

    /*
    the lambdas the expression may evaluate to
     */
    public Set<LambdaInfo> lambdas(Expression expression) {
        if (expression instanceof Lambda lambda) return Set.of(lambda.lambdaInfo());
        if (expression instanceof VariableAccess va) return valuesOf(va.variable());
        if (expression instanceof MemberAccess ma) return valuesOf(ma.member());
        if (expression instanceof Cast cast) return lambdas(cast.expression());
        if (expression instanceof Assignment a) return lambdas(a.value());
        if (expression instanceof ConditionalExpression ce) return union(lambdas(ce.ifTrue()), lambdas(ce.ifFalse()));
        if (expression instanceof NullCoalescing nc) return union(lambdas(nc.lhs()), lambdas(nc.rhs()));
        if (expression instanceof MethodCall mc) {
            Set<LambdaInfo> set = new LinkedHashSet<>();
            for (MethodInfo target : dispatch.apply(mc.method())) {
                set.addAll(valuesOf(new ReturnValue(target)));
            }
            return set;
        }
        if (expression instanceof DelegateCall dc) {
            Set<LambdaInfo> set = new LinkedHashSet<>();
            for (LambdaInfo li : lambdas(dc.delegate())) {
                set.addAll(valuesOf(new ReturnValue(li)));
            }
            return set;
        }
        return Set.of();
    }

    private Set<LambdaInfo> valuesOf(Object holder) {
        Set<LambdaInfo> set = values.get(holder);
        return set == null ? Set.of() : Collections.unmodifiableSet(set);
    }

    private static Set<LambdaInfo> union(Set<LambdaInfo> s1, Set<LambdaInfo> s2) {
        if (s1.isEmpty()) return s2;
        if (s2.isEmpty()) return s1;
        Set<LambdaInfo> set = new LinkedHashSet<>(s1);
        set.addAll(s2);
        return set;
    }
}
