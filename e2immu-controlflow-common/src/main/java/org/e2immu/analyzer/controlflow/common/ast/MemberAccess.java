package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
access to a field or a property. A null qualifier stands for an implicit 'this' (or the owner type, when the
member is static).
 */
public class MemberAccess implements Expression {
    private final Expression qualifier;
    private final Member member;

    public MemberAccess(Expression qualifier, Member member) {
        this.qualifier = qualifier;
        this.member = member;
    }

    public Expression qualifier() {
        return qualifier;
    }

    public Member member() {
        return member;
    }

    public boolean hasThisQualifier() {
        return !member.isStatic() && (qualifier == null || qualifier instanceof ThisAccess);
    }

    /*
    the qualifier is a value computed at runtime, and therefore a control flow child
     */
    public boolean hasEvaluatedQualifier() {
        return qualifier != null && !(qualifier instanceof TypeAccess) && !(qualifier instanceof ThisAccess);
    }

    @Override
    public TypeInfo type() {
        return member.type();
    }

    @Override
    public List<Element> subElements() {
        return qualifier == null ? List.of() : List.of(qualifier);
    }

    @Override
    public String toString() {
        return (qualifier == null ? "" : qualifier + ".") + member.name();
    }
}
