package io.github.eutro.cfgir.list;

import org.jetbrains.annotations.Nullable;

/**
 * A node of an intrusive doubly-linked list, whose links are stored in the node itself
 * (usually in an arena, hence the context parameter on every accessor).
 * <p>
 * Implementors only provide the six accessors; insertion and unlinking are derived here
 * and keep the container's head and tail up to date.
 *
 * @param <X> The type of the context the links are stored in.
 * @param <N> The type of the node itself.
 * @param <C> The type of the container holding nodes of this type.
 */
public interface LinkedListNode<X, N extends LinkedListNode<X, N, C>, C extends LinkedListContainer<X, N, C>> {
    @Nullable N next(X ctx);

    @Nullable N prev(X ctx);

    /**
     * Get the container this node is currently linked into.
     *
     * @param ctx The context.
     * @return The container, or null if this node is not linked.
     */
    @Nullable C container(X ctx);

    void setNext(X ctx, @Nullable N next);

    void setPrev(X ctx, @Nullable N prev);

    void setContainer(X ctx, @Nullable C container);

    /**
     * Check whether this node is linked into any container.
     *
     * @param ctx The context.
     * @return Whether it is.
     */
    default boolean isLinked(X ctx) {
        return container(ctx) != null;
    }

    /**
     * Link {@code node} directly after this one, in the same container.
     *
     * @param ctx  The context.
     * @param node The node to insert, which must not be linked anywhere.
     */
    default void insertAfter(X ctx, N node) {
        C container = Lists.requireLinked(ctx, this);
        Lists.requireUnlinked(ctx, node);
        @SuppressWarnings("unchecked")
        N self = (N) this;
        N next = next(ctx);
        node.setContainer(ctx, container);
        node.setPrev(ctx, self);
        node.setNext(ctx, next);
        setNext(ctx, node);
        if (next == null) {
            container.setTail(ctx, node);
        } else {
            next.setPrev(ctx, node);
        }
    }

    /**
     * Link {@code node} directly before this one, in the same container.
     *
     * @param ctx  The context.
     * @param node The node to insert, which must not be linked anywhere.
     */
    default void insertBefore(X ctx, N node) {
        C container = Lists.requireLinked(ctx, this);
        Lists.requireUnlinked(ctx, node);
        @SuppressWarnings("unchecked")
        N self = (N) this;
        N prev = prev(ctx);
        node.setContainer(ctx, container);
        node.setNext(ctx, self);
        node.setPrev(ctx, prev);
        setPrev(ctx, node);
        if (prev == null) {
            container.setHead(ctx, node);
        } else {
            prev.setNext(ctx, node);
        }
    }

    /**
     * Remove this node from its container, joining its neighbours.
     * <p>
     * Afterwards this node has no next, prev, or container.
     *
     * @param ctx The context.
     */
    default void unlink(X ctx) {
        C container = Lists.requireLinked(ctx, this);
        N prev = prev(ctx);
        N next = next(ctx);
        if (prev == null) {
            container.setHead(ctx, next);
        } else {
            prev.setNext(ctx, next);
        }
        if (next == null) {
            container.setTail(ctx, prev);
        } else {
            next.setPrev(ctx, prev);
        }
        setNext(ctx, null);
        setPrev(ctx, null);
        setContainer(ctx, null);
    }
}
