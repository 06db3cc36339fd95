package org.e2immu.analyzer.controlflow.common.ast;

import java.util.List;

public class GotoStatement implements Statement {

    public enum Kind {LABEL, CASE, DEFAULT}

    private final Kind kind;
    private final String label;
    private final Object caseValue;

    private GotoStatement(Kind kind, String label, Object caseValue) {
        this.kind = kind;
        this.label = label;
        this.caseValue = caseValue;
    }

    public static GotoStatement gotoLabel(String label) {
        return new GotoStatement(Kind.LABEL, label, null);
    }

    public static GotoStatement gotoCase(Object caseValue) {
        return new GotoStatement(Kind.CASE, null, caseValue);
    }

    public static GotoStatement gotoDefault() {
        return new GotoStatement(Kind.DEFAULT, null, null);
    }

    public Kind kind() {
        return kind;
    }

    public String label() {
        return label;
    }

    public Object caseValue() {
        return caseValue;
    }

    @Override
    public List<Element> subElements() {
        return List.of();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case LABEL -> "goto " + label + ";";
            case CASE -> "goto case " + caseValue + ";";
            case DEFAULT -> "goto default;";
        };
    }
}
