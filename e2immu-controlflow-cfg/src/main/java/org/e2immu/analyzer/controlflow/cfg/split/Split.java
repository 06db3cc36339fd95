package org.e2immu.analyzer.controlflow.cfg.split;

/*
A context tag on a control flow node. Nodes of the same element with different splits are different nodes.
Each kind of split has a rank; a set of splits holds at most one split per rank.
 */
public interface Split {

    int rank();
}
