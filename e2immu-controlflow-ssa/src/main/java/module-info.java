module org.e2immu.analyzer.controlflow.ssa {
    requires org.e2immu.analyzer.controlflow.common;
    requires org.e2immu.analyzer.controlflow.cfg;
    requires org.slf4j;

    exports org.e2immu.analyzer.controlflow.ssa;
    exports org.e2immu.analyzer.controlflow.ssa.callgraph;
    exports org.e2immu.analyzer.controlflow.ssa.definition;
    exports org.e2immu.analyzer.controlflow.ssa.impl;
    exports org.e2immu.analyzer.controlflow.ssa.liveness;
    exports org.e2immu.analyzer.controlflow.ssa.variable;
}
