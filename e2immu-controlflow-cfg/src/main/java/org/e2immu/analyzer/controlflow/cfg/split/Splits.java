package org.e2immu.analyzer.controlflow.cfg.split;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/*
Immutable set of splits, ordered by rank, at most one split per rank.
 */
public record Splits(List<Split> splits) {

    public static final Splits EMPTY = new Splits(List.of());

    public Splits {
        splits = List.copyOf(splits);
        assert splits.stream().map(Split::rank).distinct().count() == splits.size();
    }

    public boolean isEmpty() {
        return splits.isEmpty();
    }

    /*
    adds the split; an existing split of the same rank is replaced
     */
    public Splits with(Split split) {
        List<Split> list = new ArrayList<>(splits.size() + 1);
        for (Split s : splits) {
            if (s.rank() != split.rank()) list.add(s);
        }
        list.add(split);
        list.sort(Comparator.comparingInt(Split::rank));
        return new Splits(list);
    }

    public Splits without(int rank) {
        if (splits.stream().noneMatch(s -> s.rank() == rank)) return this;
        return new Splits(splits.stream().filter(s -> s.rank() != rank).toList());
    }

    public Split get(int rank) {
        return splits.stream().filter(s -> s.rank() == rank).findFirst().orElse(null);
    }

    public FinallySplit finallySplit(int nestLevel) {
        return get(nestLevel) instanceof FinallySplit fs ? fs : null;
    }

    public ExceptionHandlerSplit exceptionHandlerSplit() {
        return get(ExceptionHandlerSplit.RANK) instanceof ExceptionHandlerSplit ehs ? ehs : null;
    }

    public Splits withoutExceptionHandler() {
        return without(ExceptionHandlerSplit.RANK);
    }

    @Override
    public String toString() {
        return splits.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
