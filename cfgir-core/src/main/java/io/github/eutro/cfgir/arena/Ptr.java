package io.github.eutro.cfgir.arena;

import org.jetbrains.annotations.NotNull;

/**
 * A generational index into an {@link Arena}.
 * <p>
 * Two pointers are equal only if both their index and their generation are equal,
 * so a pointer to a slot that has since been freed and reused compares unequal
 * to pointers handed out for the new occupant.
 *
 * @param <D> The type of data in the arena this points into.
 */
public final class Ptr<D> implements Comparable<Ptr<?>> {
    private final int index;
    private final int generation;

    Ptr(int index, int generation) {
        this.index = index;
        this.generation = generation;
    }

    /**
     * Get the slot index of this pointer. Indices are reused after deallocation.
     *
     * @return The index.
     */
    public int index() {
        return index;
    }

    /**
     * Get the generation of the slot at the time this pointer was allocated.
     *
     * @return The generation.
     */
    public int generation() {
        return generation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Ptr<?> ptr = (Ptr<?>) o;
        return index == ptr.index && generation == ptr.generation;
    }

    @Override
    public int hashCode() {
        return 31 * index + generation;
    }

    @Override
    public int compareTo(@NotNull Ptr<?> o) {
        int c = Integer.compare(index, o.index);
        return c != 0 ? c : Integer.compare(generation, o.generation);
    }

    @Override
    public String toString() {
        return "#" + index + "." + generation;
    }
}
