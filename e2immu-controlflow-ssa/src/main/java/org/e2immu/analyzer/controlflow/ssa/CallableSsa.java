package org.e2immu.analyzer.controlflow.ssa;

import org.e2immu.analyzer.controlflow.cfg.ControlFlowGraph;
import org.e2immu.analyzer.controlflow.cfg.block.BasicBlock;
import org.e2immu.analyzer.controlflow.common.ast.Callable;
import org.e2immu.analyzer.controlflow.common.ast.Element;
import org.e2immu.analyzer.controlflow.common.ast.LambdaInfo;
import org.e2immu.analyzer.controlflow.ssa.definition.Definition;
import org.e2immu.analyzer.controlflow.ssa.definition.PhiNode;
import org.e2immu.analyzer.controlflow.ssa.definition.Read;
import org.e2immu.analyzer.controlflow.ssa.liveness.Liveness;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;

import java.util.List;
import java.util.Set;

/*
The sparse SSA form of one callable: for every source variable, its definitions, and for every read, the single
definition that reaches it. Immutable and thread-safe once constructed.

Only definitions that are live (read later, or observable after the callable) exist. Reads of untracked variables
each get their own untracked definition.
 */
public interface CallableSsa {

    Callable callable();

    ControlFlowGraph controlFlowGraph();

    Liveness liveness();

    /*
    in order of first access
     */
    Set<SourceVariable> sourceVariables();

    boolean isTracked(SourceVariable variable);

    /*
    convenience: the source variable with the given string representation, e.g. "x", "this.f", "a.b"
     */
    SourceVariable sourceVariable(String name);

    /*
    all definitions, in order of node discovery; phi nodes at the start of their block
     */
    List<Definition> definitions();

    List<Definition> definitionsOf(SourceVariable variable);

    /*
    all reads of the variable, in order of node discovery
     */
    List<Read> readsOf(SourceVariable variable);

    /*
    the reads taking place at the nodes of the access element
     */
    List<Read> readsAt(Element element);

    /*
    the definition reaching the read; never null for a read of this callable
     */
    Definition definitionReaching(Read read);

    // queries about one definition; these are also available on the definition itself

    List<Read> reads(Definition definition);

    List<Read> firstReads(Definition definition);

    List<Read> lastReads(Definition definition);

    boolean isLiveAtEndOfBlock(Definition definition, BasicBlock block);

    Set<Definition> ultimateDefinitions(Definition definition);

    Definition priorDefinition(Definition definition);

    List<Definition> inputs(PhiNode phiNode);

    Set<LambdaInfo> flowsIntoClosure(Definition definition);

    boolean flowsOutOfClosure(Definition definition);

    /*
    one line per definition, with its reads
     */
    String print();
}
