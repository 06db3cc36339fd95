module org.e2immu.analyzer.controlflow.common {
    requires org.slf4j;

    exports org.e2immu.analyzer.controlflow.common;
    exports org.e2immu.analyzer.controlflow.common.ast;
    exports org.e2immu.analyzer.controlflow.common.graph;
    exports org.e2immu.analyzer.controlflow.common.util;
}
