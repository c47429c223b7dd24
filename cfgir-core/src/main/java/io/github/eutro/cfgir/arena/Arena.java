package io.github.eutro.cfgir.arena;

import io.github.eutro.cfgir.InvalidPointerException;
import io.github.eutro.cfgir.util.F;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Generational-index storage.
 * <p>
 * Every allocation returns a {@link Ptr} that stays valid until the slot is deallocated.
 * Freed slots are reused, but with a bumped generation, so stale pointers
 * are detected rather than silently resolving to whatever now lives there.
 *
 * @param <D> The type of data stored.
 */
public final class Arena<D> {
    private final String name;
    private final List<Slot<D>> slots = new ArrayList<>();
    private int freeHead = -1;
    private int live = 0;

    /**
     * Create an empty arena.
     *
     * @param name The name of the arena, used in error messages.
     */
    public Arena(String name) {
        this.name = name;
    }

    private static final class Slot<D> {
        int generation;
        @Nullable D data;
        int nextFree = -1;
    }

    /**
     * Allocate a new slot, initializing it with data created from its own pointer.
     * <p>
     * The initializer may itself allocate in this arena. If it throws, the slot
     * is released again and the exception propagates.
     *
     * @param init The initializer, given the pointer of the slot being filled.
     * @return The pointer to the new slot.
     */
    public Ptr<D> allocWith(F<? super Ptr<D>, ? extends D> init) {
        int index;
        Slot<D> slot;
        if (freeHead != -1) {
            index = freeHead;
            slot = slots.get(index);
            freeHead = slot.nextFree;
            slot.nextFree = -1;
        } else {
            index = slots.size();
            slot = new Slot<>();
            slots.add(slot);
        }
        Ptr<D> ptr = new Ptr<>(index, slot.generation);
        D data;
        try {
            data = init.apply(ptr);
        } catch (RuntimeException | Error e) {
            release(index, slot);
            throw e;
        }
        if (data == null) {
            release(index, slot);
            throw new NullPointerException("initializer returned null");
        }
        slot.data = data;
        live++;
        return ptr;
    }

    private void release(int index, Slot<D> slot) {
        slot.data = null;
        slot.generation++;
        slot.nextFree = freeHead;
        freeHead = index;
    }

    @Nullable
    private Slot<D> liveSlot(Ptr<D> ptr) {
        if (ptr.index() < 0 || ptr.index() >= slots.size()) return null;
        Slot<D> slot = slots.get(ptr.index());
        if (slot.generation != ptr.generation() || slot.data == null) return null;
        return slot;
    }

    /**
     * Check whether the pointer refers to a live slot.
     *
     * @param ptr The pointer.
     * @return Whether dereferencing it would succeed.
     */
    public boolean isValid(Ptr<D> ptr) {
        return liveSlot(ptr) != null;
    }

    /**
     * Get the data at the pointer, or null if the slot is absent.
     *
     * @param ptr The pointer.
     * @return The data, or null.
     */
    public @Nullable D tryDeref(Ptr<D> ptr) {
        Slot<D> slot = liveSlot(ptr);
        return slot == null ? null : slot.data;
    }

    /**
     * Get the data at the pointer.
     *
     * @param ptr The pointer.
     * @return The data.
     * @throws InvalidPointerException If the slot is absent.
     */
    public @NotNull D deref(Ptr<D> ptr) {
        D data = tryDeref(ptr);
        if (data == null) {
            throw new InvalidPointerException("invalid " + name + " pointer " + ptr);
        }
        return data;
    }

    /**
     * Deallocate the slot at the pointer.
     * <p>
     * Deallocating an absent slot is a no-op, and returns empty every time.
     *
     * @param ptr The pointer.
     * @return The data that was removed, or empty if the slot was already absent.
     */
    public Optional<D> tryDealloc(Ptr<D> ptr) {
        Slot<D> slot = liveSlot(ptr);
        if (slot == null) return Optional.empty();
        D data = slot.data;
        release(ptr.index(), slot);
        live--;
        return Optional.ofNullable(data);
    }

    /**
     * Get the number of live slots in the arena.
     *
     * @return The number of live slots.
     */
    public int size() {
        return live;
    }

    @Override
    public String toString() {
        return name + " arena (" + live + " live)";
    }
}
