package org.e2immu.analyzer.controlflow.ssa.variable;

import org.e2immu.analyzer.controlflow.common.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static org.e2immu.analyzer.controlflow.ssa.variable.AssignableDefinition.Kind.*;

/*
Resolves the variable accesses in the body of a callable to source variables, and decides which of them are
tracked.

Local variables and parameters are always tracked. Fields and properties are tracked when reading them cannot
execute code (no volatile fields, only field-like properties), and when SSA form pays off: they are accessed more
than once, inside a loop, or both read and written. A qualified field is tracked only when its qualifier is.
 */
public class SourceVariableResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceVariableResolver.class);

    private final boolean trackAllFieldsAndProperties;
    private final Map<Callable, Set<LocalVariable>> declaredCache = new HashMap<>();

    public SourceVariableResolver() {
        this(false);
    }

    public SourceVariableResolver(boolean trackAllFieldsAndProperties) {
        this.trackAllFieldsAndProperties = trackAllFieldsAndProperties;
    }

    public VariableAccesses resolve(Callable callable) {
        Walker walker = new Walker(callable);
        for (ParameterInfo pi : callable.parameters()) {
            walker.write(PARAMETER, walker.local(pi), null);
        }
        if (callable.hasBody()) walker.walk(callable.body(), false);

        Set<SourceVariable> tracked = new LinkedHashSet<>();
        for (SourceVariable sv : walker.sourceVariables) {
            if (isTracked(sv, walker, tracked)) tracked.add(sv);
        }
        LOGGER.debug("Resolved {} reads, {} writes, {} source variables ({} tracked) in {}", walker.reads.size(),
                walker.writes.size(), walker.sourceVariables.size(), tracked.size(), callable);
        return new VariableAccesses(callable, List.copyOf(walker.reads), List.copyOf(walker.writes),
                Collections.unmodifiableSet(walker.sourceVariables), Collections.unmodifiableSet(tracked),
                walker.declared, List.copyOf(walker.lambdas));
    }

    /*
    source variables are visited in order of first access, so that a qualifier precedes the variables it qualifies
     */
    private boolean isTracked(SourceVariable sv, Walker walker, Set<SourceVariable> trackedSoFar) {
        if (sv instanceof SourceVariable.LocalScopeVariable) return true;
        Member member = sv.member();
        if (member instanceof FieldInfo fi && fi.isVolatile()) return false;
        if (member instanceof PropertyInfo pi && !pi.isFieldLike()) return false;
        if (sv instanceof SourceVariable.QualifiedFieldOrProp q && !trackedSoFar.contains(q.qualifier())) {
            return false;
        }
        if (trackAllFieldsAndProperties) return true;
        int count = walker.accessCount.getOrDefault(sv, 0);
        boolean read = walker.readVariables.contains(sv);
        boolean written = walker.writtenVariables.contains(sv);
        return count > 1 || walker.inLoop.contains(sv) || read && written;
    }

    /*
    parameters, and the local variables declared in the body, lambda bodies excluded
     */
    public Set<LocalVariable> declaredIn(Callable callable) {
        return declaredCache.computeIfAbsent(callable, SourceVariableResolver::computeDeclaredIn);
    }

    private static Set<LocalVariable> computeDeclaredIn(Callable callable) {
        Set<LocalVariable> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(callable.parameters());
        if (callable.hasBody()) {
            callable.body().stream().forEach(e -> {
                if (e instanceof LocalVariableDeclaration lvd) {
                    set.add(lvd.variable());
                } else if (e instanceof CatchClause cc && cc.variable() != null) {
                    set.add(cc.variable());
                } else if (e instanceof IsPattern ip && ip.pattern().binding() != null) {
                    set.add(ip.pattern().binding());
                } else if (e instanceof SwitchCase sc && sc.pattern() != null && sc.pattern().binding() != null) {
                    set.add(sc.pattern().binding());
                } else if (e instanceof SwitchArm sa && sa.pattern() != null && sa.pattern().binding() != null) {
                    set.add(sa.pattern().binding());
                }
            });
        }
        return Collections.unmodifiableSet(set);
    }

    /*
    the callable that declares the local variable, as seen from the given callable; the callable itself when the
    variable cannot be found in the enclosing callables
     */
    public Callable declaringCallable(Callable callable, LocalVariable variable) {
        for (Callable c = callable; c != null; c = c.enclosingCallable()) {
            if (declaredIn(c).contains(variable)) return c;
        }
        return callable;
    }

    /*
    the source variable held by an access expression, or null when the expression is not such an access
     */
    public SourceVariable resolve(Callable callable, Expression expression) {
        if (expression instanceof VariableAccess va) {
            LocalVariable lv = va.variable();
            return new SourceVariable.LocalScopeVariable(callable, lv, declaringCallable(callable, lv));
        }
        if (expression instanceof MemberAccess ma) {
            Expression qualifier = ma.qualifier();
            if (qualifier == null || qualifier instanceof ThisAccess || qualifier instanceof TypeAccess
                || ma.member().isStatic()) {
                return new SourceVariable.PlainFieldOrProp(callable, ma.member());
            }
            SourceVariable q = resolve(callable, qualifier);
            return q == null ? null : new SourceVariable.QualifiedFieldOrProp(callable, q, ma.member());
        }
        return null;
    }

    private class Walker {
        final Callable callable;
        final Set<LocalVariable> declared;
        final List<VariableAccesses.ReadAccess> reads = new ArrayList<>();
        final List<AssignableDefinition> writes = new ArrayList<>();
        final Set<SourceVariable> sourceVariables = new LinkedHashSet<>();
        final Map<SourceVariable, Integer> accessCount = new HashMap<>();
        final Set<SourceVariable> inLoop = new HashSet<>();
        final Set<SourceVariable> readVariables = new HashSet<>();
        final Set<SourceVariable> writtenVariables = new HashSet<>();
        final List<Lambda> lambdas = new ArrayList<>();

        Walker(Callable callable) {
            this.callable = callable;
            this.declared = declaredIn(callable);
        }

        SourceVariable local(LocalVariable lv) {
            Callable declaring = declared.contains(lv) ? callable : declaringCallable(callable, lv);
            return new SourceVariable.LocalScopeVariable(callable, lv, declaring);
        }

        /*
        the qualifier's own access has already been counted when walking the qualifier expression
         */
        private void register(SourceVariable sv, boolean loop) {
            if (sv instanceof SourceVariable.QualifiedFieldOrProp q) registerQualifier(q.qualifier());
            sourceVariables.add(sv);
            accessCount.merge(sv, 1, Integer::sum);
            if (loop) inLoop.add(sv);
        }

        private void registerQualifier(SourceVariable sv) {
            if (sv instanceof SourceVariable.QualifiedFieldOrProp q) registerQualifier(q.qualifier());
            sourceVariables.add(sv);
        }

        void read(Expression element, SourceVariable sv, boolean loop) {
            register(sv, loop);
            readVariables.add(sv);
            reads.add(new VariableAccesses.ReadAccess(element, sv));
        }

        void write(AssignableDefinition.Kind kind, SourceVariable sv, Element element) {
            write(kind, sv, element, false);
        }

        void write(AssignableDefinition.Kind kind, SourceVariable sv, Element element, boolean loop) {
            register(sv, loop);
            writtenVariables.add(sv);
            writes.add(new AssignableDefinition(kind, sv, element));
        }

        void walk(Element element, boolean loop) {
            if (element instanceof VariableAccess va) {
                read(va, local(va.variable()), loop);
            } else if (element instanceof MemberAccess ma) {
                if (ma.hasEvaluatedQualifier()) walk(ma.qualifier(), loop);
                SourceVariable sv = resolve(callable, ma);
                if (sv != null) read(ma, sv, loop);
            } else if (element instanceof Assignment a) {
                if (a.isCompound()) {
                    walk(a.target(), loop);
                } else {
                    walkTargetParts(a.target(), loop);
                }
                walk(a.value(), loop);
                writeTarget(ASSIGNMENT, a.target(), a, loop);
            } else if (element instanceof LocalVariableDeclaration lvd) {
                if (lvd.initializer() != null) {
                    walk(lvd.initializer(), loop);
                    write(DECLARATION, local(lvd.variable()), lvd, loop);
                }
            } else if (element instanceof ForEachStatement fe) {
                walk(fe.iterable(), loop);
                write(FOREACH, local(fe.variable().variable()), fe.variable(), true);
                walk(fe.body(), true);
            } else if (element instanceof LoopStatement) {
                for (Element sub : element.subElements()) walk(sub, true);
            } else if (element instanceof Call call) {
                walkCall(call, loop);
            } else if (element instanceof IsPattern ip) {
                walk(ip.expression(), loop);
                writeBinding(ip.pattern(), ip, loop);
            } else if (element instanceof SwitchCase sc) {
                writeBinding(sc.pattern(), sc, loop);
                for (Element sub : sc.subElements()) walk(sub, loop);
            } else if (element instanceof SwitchArm sa) {
                writeBinding(sa.pattern(), sa, loop);
                for (Element sub : sa.subElements()) walk(sub, loop);
            } else if (element instanceof CatchClause cc) {
                if (cc.variable() != null) write(CATCH, local(cc.variable()), cc, loop);
                for (Element sub : cc.subElements()) walk(sub, loop);
            } else if (element instanceof Lambda lambda) {
                lambdas.add(lambda);
            } else {
                for (Element sub : element.subElements()) walk(sub, loop);
            }
        }

        private void walkCall(Call call, boolean loop) {
            if (call instanceof MethodCall mc && mc.hasEvaluatedQualifier()) walk(mc.qualifier(), loop);
            if (call instanceof DelegateCall dc) walk(dc.delegate(), loop);
            List<Expression> arguments = call.arguments();
            List<Runnable> writesAtCall = new ArrayList<>();
            for (int i = 0; i < arguments.size(); i++) {
                Expression argument = arguments.get(i);
                ParameterMode mode = call.parameterMode(i);
                if (mode == ParameterMode.OUT) {
                    walkTargetParts(argument, loop);
                    writesAtCall.add(() -> writeTarget(OUT_ARGUMENT, argument, call, loop));
                } else if (mode == ParameterMode.REF) {
                    walk(argument, loop);
                    writesAtCall.add(() -> writeTarget(REF_ARGUMENT, argument, call, loop));
                } else {
                    walk(argument, loop);
                }
            }
            writesAtCall.forEach(Runnable::run);
            if (call instanceof ObjectCreation oc) {
                for (MemberInitializer mi : oc.initializers()) walk(mi.value(), loop);
            }
        }

        private void walkTargetParts(Expression target, boolean loop) {
            if (target instanceof MemberAccess ma) {
                if (ma.hasEvaluatedQualifier()) walk(ma.qualifier(), loop);
            } else if (target instanceof ArrayAccess aa) {
                walk(aa.array(), loop);
                walk(aa.index(), loop);
            } else if (!(target instanceof VariableAccess) && !(target instanceof LocalVariableDeclaration)) {
                walk(target, loop);
            }
        }

        private void writeTarget(AssignableDefinition.Kind kind, Expression target, Element at, boolean loop) {
            SourceVariable sv;
            if (target instanceof LocalVariableDeclaration lvd) {
                sv = local(lvd.variable());
            } else if (target instanceof VariableAccess va) {
                sv = local(va.variable());
            } else {
                sv = resolve(callable, target);
            }
            // array elements are not source variables
            if (sv != null) write(kind, sv, at, loop);
        }

        private void writeBinding(Pattern pattern, Element at, boolean loop) {
            if (pattern != null && pattern.binding() != null) {
                write(PATTERN, local(pattern.binding()), at, loop);
            }
        }
    }
}
