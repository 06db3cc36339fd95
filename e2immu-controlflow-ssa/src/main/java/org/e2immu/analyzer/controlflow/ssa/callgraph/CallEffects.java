package org.e2immu.analyzer.controlflow.ssa.callgraph;

import org.e2immu.analyzer.controlflow.common.ast.Callable;
import org.e2immu.analyzer.controlflow.common.ast.Element;
import org.e2immu.analyzer.controlflow.common.ast.LambdaInfo;
import org.e2immu.analyzer.controlflow.common.ast.LocalVariable;
import org.e2immu.analyzer.controlflow.ssa.variable.SourceVariable;

import java.util.List;
import java.util.Set;

/*
What the SSA construction of one callable needs to know about the rest of the program: which callables run at a
call site, and which source variables they may read or write.
 */
public interface CallEffects {

    /*
    no calls are known; used when a callable is analyzed on its own
     */
    CallEffects NONE = new CallEffects() {
        @Override
        public List<CallTarget> callTargets(Element element) {
            return List.of();
        }

        @Override
        public boolean mayWrite(CallTarget target, SourceVariable variable) {
            return false;
        }

        @Override
        public boolean mayRead(CallTarget target, SourceVariable variable) {
            return false;
        }

        @Override
        public Set<LambdaInfo> closuresAccessing(LocalVariable variable) {
            return Set.of();
        }

        @Override
        public Set<LambdaInfo> closuresReading(CallTarget target, LocalVariable variable) {
            return Set.of();
        }

        @Override
        public boolean reaches(CallTarget target, Callable callable) {
            return false;
        }
    };

    List<CallTarget> callTargets(Element element);

    boolean mayWrite(CallTarget target, SourceVariable variable);

    boolean mayRead(CallTarget target, SourceVariable variable);

    /*
    the closures, other than the declaring callable, that read or write the local variable
     */
    Set<LambdaInfo> closuresAccessing(LocalVariable variable);

    /*
    the closures reading the local variable that may run as a consequence of the call
     */
    Set<LambdaInfo> closuresReading(CallTarget target, LocalVariable variable);

    boolean reaches(CallTarget target, Callable callable);
}
