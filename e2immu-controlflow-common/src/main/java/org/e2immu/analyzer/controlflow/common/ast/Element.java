package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/*
Any node of the abstract syntax tree that can take part in control flow: statements, expressions, and the
three clause-like elements CatchClause, SwitchCase and SwitchArm.

Identity is reference identity. Two structurally equal statements are different program points.
 */
public interface Element {

    /*
    direct structural children, in source order. The body of a lambda is NOT a child of the lambda expression:
    it belongs to the LambdaInfo callable.
     */
    List<Element> subElements();

    default void visit(Predicate<Element> predicate) {
        if (predicate.test(this)) {
            for (Element element : subElements()) {
                element.visit(predicate);
            }
        }
    }

    default Stream<Element> stream() {
        return Stream.concat(Stream.of(this), subElements().stream().flatMap(Element::stream));
    }
}
