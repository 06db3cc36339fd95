package org.e2immu.analyzer.controlflow.cfg;

import org.e2immu.analyzer.controlflow.cfg.completion.Completion;
import org.e2immu.analyzer.controlflow.common.ast.Element;

/*
an element can finish when the sub-element 'element' completes; the completion is that of the whole element
 */
public record Last(Element element, Completion completion) {

    @Override
    public String toString() {
        return element + " " + completion;
    }
}
