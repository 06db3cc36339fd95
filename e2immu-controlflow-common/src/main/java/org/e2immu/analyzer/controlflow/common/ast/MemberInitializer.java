package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

/*
assignment to a member of the object being created, inside an object creation
 */
public class MemberInitializer implements Element {
    private final Member member;
    private final Expression value;

    public MemberInitializer(Member member, Expression value) {
        this.member = member;
        this.value = value;
    }

    public Member member() {
        return member;
    }

    public Expression value() {
        return value;
    }

    @Override
    public List<Element> subElements() {
        return List.of(value);
    }

    @Override
    public String toString() {
        return member.name() + " = " + value;
    }
}
