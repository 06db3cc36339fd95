package org.e2immu.analyzer.controlflow.cfg;

import org.e2immu.analyzer.controlflow.cfg.impl.ElementStructure;
import org.e2immu.analyzer.controlflow.cfg.impl.GraphConstruction;
import org.e2immu.analyzer.controlflow.common.ast.Callable;
import org.e2immu.analyzer.controlflow.common.ast.Factory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
Builds the control flow graph of a callable with a body. Stateless apart from its options: can be shared
between threads.
 */
public class ControlFlowGraphBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ControlFlowGraphBuilder.class);

    /*
    implicitExceptionsOnlyInTry: calls, casts, integral divisions and array accesses only get an exceptional
    successor inside a try block, or inside a catch clause of a try statement with a finally block.
    When false, they can throw everywhere.
     */
    public record Options(boolean implicitExceptionsOnlyInTry) {
        public static final Options DEFAULT = new Builder().build();

        public static class Builder {
            private boolean implicitExceptionsOnlyInTry = true;

            public Builder setImplicitExceptionsOnlyInTry(boolean implicitExceptionsOnlyInTry) {
                this.implicitExceptionsOnlyInTry = implicitExceptionsOnlyInTry;
                return this;
            }

            public Options build() {
                return new Options(implicitExceptionsOnlyInTry);
            }
        }
    }

    private final Factory factory;
    private final Options options;

    public ControlFlowGraphBuilder(Factory factory) {
        this(factory, Options.DEFAULT);
    }

    public ControlFlowGraphBuilder(Factory factory, Options options) {
        this.factory = factory;
        this.options = options;
    }

    public ControlFlowGraph build(Callable callable) {
        if (!callable.hasBody()) {
            throw new IllegalArgumentException("Callable " + callable.fullyQualifiedName() + " has no body");
        }
        ElementStructure structure = new ElementStructure(callable.body(), options.implicitExceptionsOnlyInTry());
        ControlFlowGraph graph = new GraphConstruction(callable, structure, factory).build();
        LOGGER.debug("Built control flow graph of {}: {} nodes, {} edges", callable.fullyQualifiedName(),
                graph.nodes().size(), graph.edges().size());
        return graph;
    }
}
