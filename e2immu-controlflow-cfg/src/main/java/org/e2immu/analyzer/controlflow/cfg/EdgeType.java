package org.e2immu.analyzer.controlflow.cfg;

/*
the type of a successor edge, derived from the completion of the source node
 */
public enum EdgeType {
    NORMAL("->"), TRUE("-T->"), FALSE("-F->"), NULL("-null->"), NOT_NULL("-nn->"),
    MATCH("-M->"), NO_MATCH("-NM->"), EMPTY("-E->"), NON_EMPTY("-NE->"),
    BREAK("-B->"), CONTINUE("-C->"), RETURN("-R->"), EXCEPTION("-X->"), GOTO("-G->");

    public final String arrow;

    EdgeType(String arrow) {
        this.arrow = arrow;
    }
}
