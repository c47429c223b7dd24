package io.github.eutro.cfgir.arena;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A typed handle into an arena owned by a context of type {@code X}.
 * <p>
 * Subclasses name the arena they point into, and are otherwise just a {@link Ptr}:
 * they are equal exactly when their pointers are.
 *
 * @param <X> The type of the context owning the arena.
 * @param <D> The type of the data pointed to.
 */
public abstract class ArenaPtr<X, D> {
    protected final Ptr<D> ptr;

    protected ArenaPtr(Ptr<D> ptr) {
        this.ptr = ptr;
    }

    /**
     * Get the arena this handle points into.
     *
     * @param ctx The context.
     * @return The arena.
     */
    protected abstract Arena<D> arena(X ctx);

    public Ptr<D> ptr() {
        return ptr;
    }

    public int index() {
        return ptr.index();
    }

    public boolean isValid(X ctx) {
        return arena(ctx).isValid(ptr);
    }

    protected @Nullable D tryDeref(X ctx) {
        return arena(ctx).tryDeref(ptr);
    }

    protected @NotNull D deref(X ctx) {
        return arena(ctx).deref(ptr);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return ptr.equals(((ArenaPtr<?, ?>) o).ptr);
    }

    @Override
    public int hashCode() {
        return ptr.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ptr;
    }
}
