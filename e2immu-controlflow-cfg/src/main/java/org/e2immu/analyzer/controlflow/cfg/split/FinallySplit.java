package org.e2immu.analyzer.controlflow.cfg.split;

import org.e2immu.analyzer.controlflow.cfg.completion.Completion;

/*
Active inside a finally block: remembers the completion with which the try block (or a catch clause) ended,
so that it can be resumed when the finally block completes normally.
The nest level is the number of finally blocks that enclose the try statement.
 */
public record FinallySplit(Completion completion, int nestLevel) implements Split {

    public FinallySplit {
        assert completion == completion.normalized();
        assert nestLevel >= 0;
    }

    @Override
    public int rank() {
        return nestLevel;
    }

    @Override
    public String toString() {
        return "finally" + (nestLevel == 0 ? "" : "(" + nestLevel + ")") + ":" + completion;
    }
}
