package org.e2immu.analyzer.controlflow.cfg;

import org.e2immu.analyzer.controlflow.cfg.split.Splits;
import org.e2immu.analyzer.controlflow.common.ast.Callable;
import org.e2immu.analyzer.controlflow.common.ast.Element;

import java.util.Objects;

/*
A node of the control flow graph of one callable: an element together with its splits, or one of the synthetic
entry and exit nodes. Equality is structural.
 */
public interface ControlFlowNode {

    Callable callable();

    /*
    null for the synthetic nodes
     */
    default Element element() {
        return null;
    }

    default Splits splits() {
        return Splits.EMPTY;
    }

    record ElementNode(Callable callable, Element element, Splits splits) implements ControlFlowNode {
        public ElementNode {
            Objects.requireNonNull(element);
            Objects.requireNonNull(splits);
        }

        @Override
        public String toString() {
            return element + (splits.isEmpty() ? "" : " " + splits);
        }
    }

    record EntryNode(Callable callable) implements ControlFlowNode {
        @Override
        public String toString() {
            return "enter " + callable.name();
        }
    }

    /*
    the exit of the callable, reached from the normal and the exceptional exit
     */
    record ExitNode(Callable callable) implements ControlFlowNode {
        @Override
        public String toString() {
            return "exit " + callable.name();
        }
    }

    record AnnotatedExitNode(Callable callable, boolean normal) implements ControlFlowNode {
        @Override
        public String toString() {
            return "exit " + callable.name() + (normal ? " (normal)" : " (abnormal)");
        }
    }
}
