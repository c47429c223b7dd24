package io.github.eutro.cfgir.list;

import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;

// the following node is read before the current one is handed out,
// so callers may unlink whatever they were just given
final class NodeIterator<X, N> implements Iterator<N> {
    private final X ctx;
    private final BiFunction<N, X, N> step;
    private @Nullable N upcoming;

    NodeIterator(X ctx, @Nullable N first, BiFunction<N, X, N> step) {
        this.ctx = ctx;
        this.upcoming = first;
        this.step = step;
    }

    @Override
    public boolean hasNext() {
        return upcoming != null;
    }

    @Override
    public N next() {
        N current = upcoming;
        if (current == null) throw new NoSuchElementException();
        upcoming = step.apply(current, ctx);
        return current;
    }
}
