package org.e2immu.analyzer.controlflow.cfg.completion;

import org.e2immu.analyzer.controlflow.cfg.EdgeType;
import org.e2immu.analyzer.controlflow.common.ast.TypeInfo;

import java.util.Objects;

/*
How the execution of a statement or an expression ends.

The normal completions (Normal, Boolean, Nullness, Match, Empty, BreakNormal) continue with the next element
in evaluation order; the other ones are abrupt: they propagate upwards until a construct consumes them.
 */
public interface Completion {

    EdgeType edgeType();

    default boolean isNormal() {
        return false;
    }

    /*
    completion kept in a finally split: all normal completions become Normal
     */
    default Completion normalized() {
        return isNormal() ? NORMAL : this;
    }

    record Normal() implements Completion {
        @Override
        public EdgeType edgeType() {
            return EdgeType.NORMAL;
        }

        @Override
        public boolean isNormal() {
            return true;
        }

        @Override
        public String toString() {
            return "normal";
        }
    }

    /*
    completion of an expression in a boolean context: a condition, the left operand of && or ||, a filter, a guard
     */
    record Boolean(boolean value) implements Completion {
        @Override
        public EdgeType edgeType() {
            return value ? EdgeType.TRUE : EdgeType.FALSE;
        }

        @Override
        public boolean isNormal() {
            return true;
        }

        @Override
        public String toString() {
            return java.lang.Boolean.toString(value);
        }
    }

    /*
    completion of the left operand of ??
     */
    record Nullness(boolean isNull) implements Completion {
        @Override
        public EdgeType edgeType() {
            return isNull ? EdgeType.NULL : EdgeType.NOT_NULL;
        }

        @Override
        public boolean isNormal() {
            return true;
        }

        @Override
        public String toString() {
            return isNull ? "null" : "not-null";
        }
    }

    record Throw(TypeInfo exceptionType) implements Completion {
        public Throw {
            Objects.requireNonNull(exceptionType);
        }

        @Override
        public EdgeType edgeType() {
            return EdgeType.EXCEPTION;
        }

        @Override
        public String toString() {
            return "throw(" + exceptionType + ")";
        }
    }

    record Break() implements Completion {
        @Override
        public EdgeType edgeType() {
            return EdgeType.BREAK;
        }

        @Override
        public String toString() {
            return "break";
        }
    }

    /*
    a loop or switch exited by a break: the construct completes normally, but the edge keeps the BREAK type
     */
    record BreakNormal() implements Completion {
        @Override
        public EdgeType edgeType() {
            return EdgeType.BREAK;
        }

        @Override
        public boolean isNormal() {
            return true;
        }

        @Override
        public String toString() {
            return "break-normal";
        }
    }

    record Continue() implements Completion {
        @Override
        public EdgeType edgeType() {
            return EdgeType.CONTINUE;
        }

        @Override
        public String toString() {
            return "continue";
        }
    }

    record Return() implements Completion {
        @Override
        public EdgeType edgeType() {
            return EdgeType.RETURN;
        }

        @Override
        public String toString() {
            return "return";
        }
    }

    record GotoLabel(String label) implements Completion {
        @Override
        public EdgeType edgeType() {
            return EdgeType.GOTO;
        }

        @Override
        public String toString() {
            return "goto(" + label + ")";
        }
    }

    record GotoCase(Object value) implements Completion {
        @Override
        public EdgeType edgeType() {
            return EdgeType.GOTO;
        }

        @Override
        public String toString() {
            return "goto-case(" + value + ")";
        }
    }

    record GotoDefault() implements Completion {
        @Override
        public EdgeType edgeType() {
            return EdgeType.GOTO;
        }

        @Override
        public String toString() {
            return "goto-default";
        }
    }

    /*
    result of matching a pattern, a catch clause or a case
     */
    record Match(boolean match) implements Completion {
        @Override
        public EdgeType edgeType() {
            return match ? EdgeType.MATCH : EdgeType.NO_MATCH;
        }

        @Override
        public boolean isNormal() {
            return true;
        }

        @Override
        public String toString() {
            return match ? "match" : "no-match";
        }
    }

    /*
    result of the emptiness test of a foreach loop
     */
    record Empty(boolean empty) implements Completion {
        @Override
        public EdgeType edgeType() {
            return empty ? EdgeType.EMPTY : EdgeType.NON_EMPTY;
        }

        @Override
        public boolean isNormal() {
            return true;
        }

        @Override
        public String toString() {
            return empty ? "empty" : "non-empty";
        }
    }

    Completion NORMAL = new Normal();
    Completion TRUE = new Boolean(true);
    Completion FALSE = new Boolean(false);
    Completion NULL = new Nullness(true);
    Completion NOT_NULL = new Nullness(false);
    Completion BREAK = new Break();
    Completion BREAK_NORMAL = new BreakNormal();
    Completion CONTINUE = new Continue();
    Completion RETURN = new Return();
    Completion GOTO_DEFAULT = new GotoDefault();
    Completion MATCH = new Match(true);
    Completion NO_MATCH = new Match(false);
    Completion EMPTY = new Empty(true);
    Completion NON_EMPTY = new Empty(false);
}
