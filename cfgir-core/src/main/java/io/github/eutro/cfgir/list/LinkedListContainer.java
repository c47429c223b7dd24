package io.github.eutro.cfgir.list;

import org.jetbrains.annotations.Nullable;

/**
 * A container of an intrusive doubly-linked list of nodes of type {@code N}.
 *
 * @param <X> The type of the context the links are stored in.
 * @param <N> The type of the nodes.
 * @param <C> The type of the container itself.
 * @see LinkedListNode
 */
public interface LinkedListContainer<X, N extends LinkedListNode<X, N, C>, C extends LinkedListContainer<X, N, C>> {
    @Nullable N head(X ctx);

    @Nullable N tail(X ctx);

    void setHead(X ctx, @Nullable N head);

    void setTail(X ctx, @Nullable N tail);

    default boolean isEmpty(X ctx) {
        return head(ctx) == null;
    }

    /**
     * Check whether {@code node} is currently linked into this container.
     *
     * @param ctx  The context.
     * @param node The node.
     * @return Whether it is.
     */
    default boolean contains(X ctx, N node) {
        return equals(node.container(ctx));
    }

    /**
     * Link {@code node} at the end of this container.
     *
     * @param ctx  The context.
     * @param node The node, which must not be linked anywhere.
     */
    default void append(X ctx, N node) {
        N tail = tail(ctx);
        if (tail != null) {
            tail.insertAfter(ctx, node);
        } else {
            Lists.linkOnly(ctx, this, node);
        }
    }

    /**
     * Link {@code node} at the start of this container.
     *
     * @param ctx  The context.
     * @param node The node, which must not be linked anywhere.
     */
    default void prepend(X ctx, N node) {
        N head = head(ctx);
        if (head != null) {
            head.insertBefore(ctx, node);
        } else {
            Lists.linkOnly(ctx, this, node);
        }
    }

    /**
     * Iterate over the nodes of this container, from head to tail.
     * <p>
     * The returned iterable is lazy and may be iterated more than once.
     * The node most recently yielded may be unlinked (or removed entirely)
     * without disturbing the iteration.
     *
     * @param ctx The context.
     * @return The nodes.
     */
    default Iterable<N> iter(X ctx) {
        return () -> new NodeIterator<>(ctx, head(ctx), (n, c) -> n.next(c));
    }

    /**
     * Iterate over the nodes of this container, from tail to head.
     *
     * @param ctx The context.
     * @return The nodes.
     * @see #iter(Object)
     */
    default Iterable<N> iterBackward(X ctx) {
        return () -> new NodeIterator<>(ctx, tail(ctx), (n, c) -> n.prev(c));
    }
}
