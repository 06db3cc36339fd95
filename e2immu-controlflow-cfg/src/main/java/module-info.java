module org.e2immu.analyzer.controlflow.cfg {
    requires org.e2immu.analyzer.controlflow.common;
    requires org.slf4j;

    exports org.e2immu.analyzer.controlflow.cfg;
    exports org.e2immu.analyzer.controlflow.cfg.block;
    exports org.e2immu.analyzer.controlflow.cfg.completion;
    exports org.e2immu.analyzer.controlflow.cfg.dominance;
    exports org.e2immu.analyzer.controlflow.cfg.impl;
    exports org.e2immu.analyzer.controlflow.cfg.split;
}
