package io.github.eutro.cfgir.list;

import io.github.eutro.cfgir.StructuralPreconditionException;

final class Lists {
    private Lists() {
    }

    static <X, N extends LinkedListNode<X, N, C>, C extends LinkedListContainer<X, N, C>>
    C requireLinked(X ctx, LinkedListNode<X, N, C> node) {
        C container = node.container(ctx);
        if (container == null) {
            throw new StructuralPreconditionException(node + " is not linked into a container");
        }
        return container;
    }

    static <X, N extends LinkedListNode<X, N, C>, C extends LinkedListContainer<X, N, C>>
    void requireUnlinked(X ctx, N node) {
        C container = node.container(ctx);
        if (container != null) {
            throw new StructuralPreconditionException(node + " is already linked into " + container);
        }
    }

    @SuppressWarnings("unchecked")
    static <X, N extends LinkedListNode<X, N, C>, C extends LinkedListContainer<X, N, C>>
    void linkOnly(X ctx, LinkedListContainer<X, N, C> container, N node) {
        requireUnlinked(ctx, node);
        node.setContainer(ctx, (C) container);
        node.setPrev(ctx, null);
        node.setNext(ctx, null);
        container.setHead(ctx, node);
        container.setTail(ctx, node);
    }
}
