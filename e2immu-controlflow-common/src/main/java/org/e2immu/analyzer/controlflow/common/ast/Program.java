package org.e2immu.analyzer.controlflow.common.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/*
the set of types that are analyzed together; the call graph is computed over all of them
 */
public class Program {
    private final List<TypeInfo> types;
    private final List<Callable> callables;

    public Program(List<TypeInfo> types) {
        this.types = List.copyOf(types);
        List<Callable> list = new ArrayList<>();
        for (TypeInfo typeInfo : this.types) {
            typeInfo.methodStream().filter(Callable::hasBody).forEach(mi -> addWithLambdas(mi, list));
        }
        this.callables = List.copyOf(list);
    }

    private static void addWithLambdas(Callable callable, List<Callable> list) {
        list.add(callable);
        lambdasIn(callable).forEach(li -> addWithLambdas(li, list));
    }

    /*
    the lambdas created directly in the body of this callable, not those nested in them
     */
    public static Stream<LambdaInfo> lambdasIn(Callable callable) {
        if (!callable.hasBody()) return Stream.empty();
        return callable.body().stream()
                .filter(e -> e instanceof Lambda l && l.lambdaInfo().hasBody())
                .map(e -> ((Lambda) e).lambdaInfo());
    }

    public List<TypeInfo> types() {
        return types;
    }

    /*
    all methods, constructors, accessors and lambdas with a body, lambdas after their enclosing callable
     */
    public List<Callable> callables() {
        return callables;
    }

    /*
    all methods and accessors, with or without body
     */
    public Stream<MethodInfo> methodStream() {
        return types.stream().flatMap(TypeInfo::methodStream);
    }
}
