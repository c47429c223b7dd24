package io.github.eutro.cfgir.util;

import io.github.eutro.cfgir.ir.Block;
import io.github.eutro.cfgir.ir.IrContext;

import java.util.*;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    /**
     * The root of the walk.
     */
    final T root;
    /**
     * The successor function.
     */
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Elements yielded later by the successor function will be visited first.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over {@link Block}s, following their successor edges.
     *
     * @param ctx  The context the blocks live in.
     * @param root The root block.
     * @return The graph walker.
     */
    public static GraphWalker<Block> blockWalker(IrContext ctx, Block root) {
        return new GraphWalker<>(root, $ -> $.successorBlocks(ctx));
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Get the post-order traversal of the graph.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }

    private static final class Frame<T> {
        final T node;
        boolean expanded;

        Frame(T node) {
            this.node = node;
        }
    }

    private class PostIter implements Iterator<T> {
        // a node is yielded once every child it pushed has been yielded
        private final Deque<Frame<T>> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.addLast(new Frame<>(root));
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            Frame<T> top = stack.getLast();
            while (!top.expanded) {
                top.expanded = true;
                for (T child : getChildren.apply(top.node)) {
                    if (seen.add(child)) {
                        stack.addLast(new Frame<>(child));
                    }
                }
                top = stack.getLast();
            }
            stack.removeLast();
            return top.node;
        }
    }
}
